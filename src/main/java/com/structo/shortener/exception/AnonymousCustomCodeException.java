package com.structo.shortener.exception;

public class AnonymousCustomCodeException extends InvalidInputException {
    public AnonymousCustomCodeException() {
        super("Authentication required for custom short codes.");
    }
}
