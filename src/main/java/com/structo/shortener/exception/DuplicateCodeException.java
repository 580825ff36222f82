package com.structo.shortener.exception;

import lombok.Getter;

/**
 * The store rejected an insert because the short code is already taken.
 */
@Getter
public class DuplicateCodeException extends ShortenerException {
    private final String code;

    public DuplicateCodeException(String code, Throwable cause) {
        super("Short code already exists: " + code, cause);
        this.code = code;
    }
}
