package com.siva.lookup.exception;

/**
 * Thrown when an id is resolved that does not exist in the backing lookup table.
 */
public class NotFoundException extends LookupException {

    private final String table;
    private final int id;

    public NotFoundException(String table, int id) {
        super("No entry with id " + id + " in lookup table '" + table + "'");
        this.table = table;
        this.id = id;
    }

    public String getTable() {
        return table;
    }

    public int getId() {
        return id;
    }
}
