package com.structo.shortener.exception;

public class ConflictException extends ShortenerException {
    public ConflictException(String message) {
        super(message);
    }
}
