package com.siva.lookup.service;

import com.siva.lookup.configuration.LookupTable;
import com.siva.lookup.exception.UnknownLookupTableException;
import com.siva.lookup.repo.LookupStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import java.util.*;

/**
 * Owns one {@link InternCache} per configured lookup table for the lifetime of the process.
 */
public class LookupService {

  private static final Logger log = LoggerFactory.getLogger(LookupService.class);

  private final Map<String, InternCache> caches = new LinkedHashMap<>();
  private final boolean preload;

  public LookupService(LookupStore store, Collection<LookupTable> tables, boolean preload, int warnSize) {
    this.preload = preload;
    for (LookupTable t : tables) {
      if (caches.putIfAbsent(t.name(), new InternCache(t, store, warnSize)) != null) {
        throw new IllegalArgumentException("Lookup table '" + t.name() + "' configured twice");
      }
    }
  }

  @PostConstruct
  public void init() {
    for (InternCache cache : caches.values()) {
      String name = cache.table().name();
      // 1) Indexes back the uniqueness the caches rely on
      try {
        cache.ensureIndexes();
      } catch (Exception e) {
        // Don't fail startup; the cache retries before its first create
        log.warn("LookupService: ensureIndexes() failed for table={}; will retry before first create", name, e);
      }

      // 2) Warm the cache; an empty cache still resolves lazily
      if (!preload) continue;
      try {
        cache.preload();
      } catch (Exception e) {
        log.warn("LookupService: preload failed for table={}, continuing with empty cache", name, e);
      }
    }
    log.info("LookupService: managing lookup tables {}", caches.keySet());
  }

  /* ======================== Public API ======================== */

  public InternCache cache(String table) {
    InternCache cache = caches.get(table);
    if (cache == null) throw new UnknownLookupTableException(table);
    return cache;
  }

  public LookupAttribute attribute(String attribute, String table) {
    return new LookupAttribute(attribute, cache(table));
  }

  public int idFor(String table, String name) {
    return cache(table).idFor(name);
  }

  public String nameFor(String table, int id) {
    return cache(table).nameFor(id);
  }

  public boolean invalidate(String table, String name) {
    return cache(table).invalidate(name);
  }

  public boolean invalidate(String table, int id) {
    return cache(table).invalidate(id);
  }

  public int preload(String table) {
    return cache(table).preload();
  }

  /** Configured table names with their current cache sizes, in configuration order. */
  public Map<String, Integer> tables() {
    Map<String, Integer> out = new LinkedHashMap<>();
    caches.forEach((name, cache) -> out.put(name, cache.size()));
    return out;
  }
}
