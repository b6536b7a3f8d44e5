// repo/InMemoryLookupStore.java
package com.siva.lookup.repo;

import com.siva.lookup.configuration.LookupTable;
import com.siva.lookup.exception.DuplicateNameException;
import com.siva.lookup.model.LookupEntry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for development and tests. Not persisted across restarts.
 * Enforces the same per-table name uniqueness as the Mongo store.
 */
public class InMemoryLookupStore implements LookupStore {

  private static final class Rows {
    final Map<String, LookupEntry> byName = new HashMap<>();
    final TreeMap<Integer, LookupEntry> byId = new TreeMap<>();
    int lastId = 0;
  }

  private final Map<String, Rows> tables = new ConcurrentHashMap<>();

  private Rows rows(LookupTable table) {
    return tables.computeIfAbsent(table.name(), k -> new Rows());
  }

  @Override
  public void ensureIndexes(LookupTable table) {
    rows(table);
  }

  @Override
  public Optional<LookupEntry> findByName(LookupTable table, String name) {
    Rows r = rows(table);
    synchronized (r) {
      return Optional.ofNullable(r.byName.get(name));
    }
  }

  @Override
  public Optional<LookupEntry> findById(LookupTable table, int id) {
    Rows r = rows(table);
    synchronized (r) {
      return Optional.ofNullable(r.byId.get(id));
    }
  }

  @Override
  public LookupEntry createWithUniqueName(LookupTable table, String name) {
    Rows r = rows(table);
    synchronized (r) {
      if (r.byName.containsKey(name)) {
        throw new DuplicateNameException(table.name(), name);
      }
      var entry = LookupEntry.builder().table(table.name()).id(++r.lastId).name(name).build();
      r.byName.put(name, entry);
      r.byId.put(entry.getId(), entry);
      return entry;
    }
  }

  @Override
  public List<LookupEntry> findAll(LookupTable table) {
    Rows r = rows(table);
    synchronized (r) {
      return new ArrayList<>(r.byId.values());
    }
  }

  /** Removes a row as an administrator would, bypassing any cache. */
  public boolean delete(LookupTable table, String name) {
    Rows r = rows(table);
    synchronized (r) {
      var removed = r.byName.remove(name);
      if (removed == null) return false;
      r.byId.remove(removed.getId());
      return true;
    }
  }
}
