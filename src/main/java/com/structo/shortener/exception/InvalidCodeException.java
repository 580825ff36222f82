package com.structo.shortener.exception;

public class InvalidCodeException extends InvalidInputException {
    public InvalidCodeException(String message) {
        super(message);
    }
}
