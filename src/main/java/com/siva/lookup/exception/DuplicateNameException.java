package com.siva.lookup.exception;

/**
 * Raised by a store when a create lost the race for a name already present in the table.
 */
public class DuplicateNameException extends LookupException {

    private final String table;
    private final String name;

    public DuplicateNameException(String table, String name, Throwable cause) {
        super("Name '" + name + "' already exists in lookup table '" + table + "'", cause);
        this.table = table;
        this.name = name;
    }

    public DuplicateNameException(String table, String name) {
        this(table, name, null);
    }

    public String getTable() {
        return table;
    }

    public String getName() {
        return name;
    }
}
