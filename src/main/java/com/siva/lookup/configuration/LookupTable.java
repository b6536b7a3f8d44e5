package com.siva.lookup.configuration;

import java.util.Objects;

/**
 * Static description of one lookup table: where its rows live and which columns hold the
 * id and the name. Built once at startup and handed to whatever needs to resolve values.
 *
 * @param name       table name, e.g. {@code car_types}
 * @param idColumn   column holding the store-assigned integer id
 * @param nameColumn column holding the unique name
 */
public record LookupTable(String name, String idColumn, String nameColumn) {

  public static final String DEFAULT_ID_COLUMN = "id";
  public static final String DEFAULT_NAME_COLUMN = "name";

  public LookupTable {
    Objects.requireNonNull(name, "table name cannot be null.");
    if (name.isBlank()) throw new IllegalArgumentException("table name cannot be blank.");
    idColumn = (idColumn == null || idColumn.isBlank()) ? DEFAULT_ID_COLUMN : idColumn;
    nameColumn = (nameColumn == null || nameColumn.isBlank()) ? DEFAULT_NAME_COLUMN : nameColumn;
    if (idColumn.equals(nameColumn)) {
      throw new IllegalArgumentException("id and name columns must differ for table " + name);
    }
  }

  public static LookupTable of(String name) {
    return new LookupTable(name, DEFAULT_ID_COLUMN, DEFAULT_NAME_COLUMN);
  }
}
