package com.siva.lookup.exception;

public class UnknownLookupTableException extends LookupException {

    public UnknownLookupTableException(String table) {
        super("Lookup table '" + table + "' is not configured");
    }
}
