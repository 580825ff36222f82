package com.structo.shortener.exception;

public class UnauthorizedException extends ShortenerException {
    public UnauthorizedException() {
        this("Authentication required.");
    }

    public UnauthorizedException(String message) {
        super(message);
    }
}
