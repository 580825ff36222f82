package com.structo.shortener.exception;

public class InvalidInputException extends ShortenerException {
    public InvalidInputException(String message) {
        super(message);
    }
}
