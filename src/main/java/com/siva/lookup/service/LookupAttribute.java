package com.siva.lookup.service;

import java.util.Objects;

/**
 * A model attribute stored as an id into a lookup table, e.g. {@code car_type} on a car
 * backed by {@code car_types}. Declared once and shared by the code that reads or writes it.
 * Unset values are {@code null} in both representations.
 */
public class LookupAttribute {

  private final String attribute;
  private final InternCache cache;

  public LookupAttribute(String attribute, InternCache cache) {
    this.attribute = Objects.requireNonNull(attribute, "attribute cannot be null.");
    this.cache = Objects.requireNonNull(cache, "cache cannot be null.");
  }

  public String attribute() {
    return attribute;
  }

  /** Column holding the id on the owning model, e.g. {@code car_type_id}. */
  public String idColumn() {
    return attribute + "_id";
  }

  public String table() {
    return cache.table().name();
  }

  /** Value to store for {@code name}; blank names clear the attribute. */
  public Integer toId(String name) {
    if (name == null || name.isBlank()) return null;
    return cache.idFor(name);
  }

  public String toName(Integer id) {
    return id == null ? null : cache.nameFor(id);
  }
}
