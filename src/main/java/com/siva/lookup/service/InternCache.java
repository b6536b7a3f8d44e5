package com.siva.lookup.service;

import com.siva.lookup.configuration.LookupTable;
import com.siva.lookup.exception.DuplicateNameException;
import com.siva.lookup.exception.NotFoundException;
import com.siva.lookup.exception.StoreException;
import com.siva.lookup.model.LookupEntry;
import com.siva.lookup.repo.LookupStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Name/id intern cache for a single lookup table.
 * - Hits are served from memory without touching the store
 * - Misses read through to the store and create the row when the name is new
 * - Both directions are updated together under one write lock
 *
 * Entries are never evicted or expired; lookup tables are expected to stay small.
 */
public class InternCache {

  private static final Logger log = LoggerFactory.getLogger(InternCache.class);

  private final LookupTable table;
  private final LookupStore store;
  private final int warnSize;

  private final Map<String, Integer> nameToId = new HashMap<>();
  private final Map<Integer, String> idToName = new HashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final AtomicBoolean sizeWarned = new AtomicBoolean(false);
  private volatile boolean indexesEnsured;

  public InternCache(LookupTable table, LookupStore store) {
    this(table, store, Integer.MAX_VALUE);
  }

  public InternCache(LookupTable table, LookupStore store, int warnSize) {
    this.table = Objects.requireNonNull(table, "table cannot be null.");
    this.store = Objects.requireNonNull(store, "store cannot be null.");
    this.warnSize = warnSize;
  }

  public LookupTable table() {
    return table;
  }

  /* ======================== Public API ======================== */

  /**
   * Returns the id for {@code name}, creating the row if the table does not have it yet.
   *
   * @throws IllegalArgumentException if name is null or blank
   * @throws StoreException if the store fails
   */
  public int idFor(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank for lookup table '" + table.name() + "'");
    }

    Integer cached = cachedId(name);
    if (cached != null) return cached;

    var found = store.findByName(table, name);
    if (found.isPresent()) {
      return remember(found.get());
    }

    // Without the unique index a lost race would produce a second row.
    ensureIndexes();

    LookupEntry created;
    try {
      created = store.createWithUniqueName(table, name);
      log.debug("InternCache: created {}={} in '{}'", created.getId(), name, table.name());
    } catch (DuplicateNameException e) {
      // Another caller or process won the create; use its row.
      created = store.findByName(table, name).orElseThrow(() -> new StoreException(
              "Name '" + name + "' reported as duplicate but not readable in '" + table.name() + "'", e));
      log.debug("InternCache: lost create race for '{}' in '{}', using id {}", name, table.name(), created.getId());
    }
    return remember(created);
  }

  /**
   * Returns the name stored under {@code id}.
   *
   * @throws NotFoundException if the table has no row with that id
   * @throws StoreException if the store fails
   */
  public String nameFor(int id) {
    String cached = cachedName(id);
    if (cached != null) return cached;

    var entry = store.findById(table, id).orElseThrow(() -> new NotFoundException(table.name(), id));
    remember(entry);
    return entry.getName();
  }

  /**
   * Makes sure the store enforces name uniqueness for this table. Repeated until it succeeds once.
   *
   * @throws StoreException if the store cannot create the indexes
   */
  public void ensureIndexes() {
    if (indexesEnsured) return;
    synchronized (this) {
      if (indexesEnsured) return;
      store.ensureIndexes(table);
      indexesEnsured = true;
    }
  }

  /** Drops the pair for {@code name} from both directions. The store is not touched. */
  public boolean invalidate(String name) {
    lock.writeLock().lock();
    try {
      Integer id = nameToId.remove(name);
      if (id == null) return false;
      idToName.remove(id);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Drops the pair for {@code id} from both directions. The store is not touched. */
  public boolean invalidate(int id) {
    lock.writeLock().lock();
    try {
      String name = idToName.remove(id);
      if (name == null) return false;
      nameToId.remove(name);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void clear() {
    lock.writeLock().lock();
    try {
      nameToId.clear();
      idToName.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Loads every row of the table into the cache; returns the resulting cache size. */
  public int preload() {
    List<LookupEntry> entries = store.findAll(table);
    for (LookupEntry e : entries) remember(e);
    log.info("InternCache: preloaded {} entries for '{}'", entries.size(), table.name());
    return size();
  }

  public boolean contains(String name) {
    return cachedId(name) != null;
  }

  public int size() {
    lock.readLock().lock();
    try {
      return nameToId.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /* ======================== Internals ======================== */

  private Integer cachedId(String name) {
    lock.readLock().lock();
    try {
      return nameToId.get(name);
    } finally {
      lock.readLock().unlock();
    }
  }

  private String cachedName(int id) {
    lock.readLock().lock();
    try {
      return idToName.get(id);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Records a persisted row in both directions, replacing any pair it conflicts with. */
  private int remember(LookupEntry entry) {
    int size;
    lock.writeLock().lock();
    try {
      Integer oldId = nameToId.put(entry.getName(), entry.getId());
      if (oldId != null && oldId != entry.getId()) idToName.remove(oldId);
      String oldName = idToName.put(entry.getId(), entry.getName());
      if (oldName != null && !oldName.equals(entry.getName())) nameToId.remove(oldName);
      size = nameToId.size();
    } finally {
      lock.writeLock().unlock();
    }
    if (size > warnSize && sizeWarned.compareAndSet(false, true)) {
      log.warn("InternCache: '{}' holds {} entries (warn threshold {}); entries are never evicted",
              table.name(), size, warnSize);
    }
    return entry.getId();
  }
}
