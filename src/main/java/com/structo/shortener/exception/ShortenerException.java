package com.structo.shortener.exception;

/**
 * Base type for business-rule failures raised by the shortening core.
 */
public class ShortenerException extends RuntimeException {
    public ShortenerException(String message) {
        super(message);
    }

    public ShortenerException(String message, Throwable cause) {
        super(message, cause);
    }
}
