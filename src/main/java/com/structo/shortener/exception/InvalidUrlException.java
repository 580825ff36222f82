package com.structo.shortener.exception;

public class InvalidUrlException extends InvalidInputException {
    public InvalidUrlException(String message) {
        super(message);
    }
}
