package com.siva.lookup.exception;

/**
 * Thrown when the underlying store cannot serve a read or a create.
 * Never retried by the cache.
 */
public class StoreException extends LookupException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
