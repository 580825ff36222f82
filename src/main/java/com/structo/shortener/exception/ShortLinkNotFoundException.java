package com.structo.shortener.exception;

/**
 * Raised both for codes that do not exist and for codes owned by someone else.
 */
public class ShortLinkNotFoundException extends NotFoundException {
    public ShortLinkNotFoundException() {
        super("URL not found or you don't have permission.");
    }
}
