package com.structo.shortener.exception;

import lombok.Getter;

@Getter
public class CodeAlreadyExistsException extends ConflictException {
    private final String code;

    public CodeAlreadyExistsException(String code) {
        super("The code '" + code + "' is already taken.");
        this.code = code;
    }
}
