package com.structo.shortener.exception;

public class NotFoundException extends ShortenerException {
    public NotFoundException(String message) {
        super(message);
    }
}
