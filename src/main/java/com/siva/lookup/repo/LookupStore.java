// repo/LookupStore.java
package com.siva.lookup.repo;

import com.siva.lookup.configuration.LookupTable;
import com.siva.lookup.exception.DuplicateNameException;
import com.siva.lookup.exception.StoreException;
import com.siva.lookup.model.LookupEntry;

import java.util.List;
import java.util.Optional;

/**
 * Minimal persistence contract behind an intern cache. Every method may throw
 * {@link StoreException} when the backing store fails.
 */
public interface LookupStore {

  /** Makes sure names and ids are unique per table. Safe to call repeatedly. */
  void ensureIndexes(LookupTable table);

  Optional<LookupEntry> findByName(LookupTable table, String name);

  Optional<LookupEntry> findById(LookupTable table, int id);

  /**
   * Persists a new entry; the store assigns its id.
   *
   * @throws DuplicateNameException if the name already exists in the table
   */
  LookupEntry createWithUniqueName(LookupTable table, String name);

  List<LookupEntry> findAll(LookupTable table);
}
