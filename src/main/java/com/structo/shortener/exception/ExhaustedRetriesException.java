package com.structo.shortener.exception;

/**
 * Every generated candidate collided. A fresh attempt starts a new sequence, so callers may retry.
 */
public class ExhaustedRetriesException extends ShortenerException {
    public ExhaustedRetriesException(int attempts) {
        super("Unable to generate a unique short code after " + attempts + " attempts. Please try again.");
    }
}
