package com.siva.lookup.exception;

/**
 * Base runtime exception for lookup table and intern cache failures.
 */
public class LookupException extends RuntimeException {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
