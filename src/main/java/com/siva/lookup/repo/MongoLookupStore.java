// repo/MongoLookupStore.java
package com.siva.lookup.repo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoServerException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.siva.lookup.configuration.LookupProperties;
import com.siva.lookup.configuration.LookupTable;
import com.siva.lookup.database.MongoDataSource;
import com.siva.lookup.exception.DuplicateNameException;
import com.siva.lookup.exception.StoreException;
import com.siva.lookup.model.LookupEntry;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Keeps every lookup table in one collection, discriminated by a {@code table} field:
 * <pre>{ table: "car_types", id: 1, name: "Sports", createdAt: ISODate(..) }</pre>
 * Ids come from a per-table counter document, so they start at 1 and grow by one.
 */
public class MongoLookupStore implements LookupStore {

  private static final Logger LOG = LoggerFactory.getLogger(MongoLookupStore.class);

  static final String TABLE_FIELD = "table";
  static final String CREATED_AT_FIELD = "createdAt";
  static final String SEQ_FIELD = "seq";
  private static final String INDEX_TOKEN = "index: ";

  private final MongoCollection<Document> col;
  private final MongoCollection<Document> counters;

  public MongoLookupStore(MongoDataSource ds, LookupProperties props) {
    this(ds.getCollection(props.getCollection()), ds.getCollection(props.getCountersCollection()));
  }

  public MongoLookupStore(MongoCollection<Document> col, MongoCollection<Document> counters) {
    this.col = col;
    this.counters = counters;
  }

  // Length-prefixed so no two (table, column) pairs share an index name.
  static String nameIndex(LookupTable table) {
    return indexName(table, table.nameColumn());
  }

  static String idIndex(LookupTable table) {
    return indexName(table, table.idColumn());
  }

  private static String indexName(LookupTable table, String column) {
    return "uniq_" + table.name().length() + "_" + table.name() + "_" + column;
  }

  @Override
  public void ensureIndexes(LookupTable table) {
    // Partial indexes, so tables with different column names can share the collection.
    var onlyThisTable = Filters.eq(TABLE_FIELD, table.name());
    try {
      col.createIndex(Indexes.ascending(TABLE_FIELD, table.nameColumn()),
              new IndexOptions().unique(true).name(nameIndex(table)).partialFilterExpression(onlyThisTable));
      col.createIndex(Indexes.ascending(TABLE_FIELD, table.idColumn()),
              new IndexOptions().unique(true).name(idIndex(table)).partialFilterExpression(onlyThisTable));
    } catch (MongoException e) {
      throw new StoreException("Failed to ensure indexes for lookup table '" + table.name() + "'", e);
    }
  }

  @Override
  public Optional<LookupEntry> findByName(LookupTable table, String name) {
    return findOne(table, Filters.and(Filters.eq(TABLE_FIELD, table.name()), Filters.eq(table.nameColumn(), name)));
  }

  @Override
  public Optional<LookupEntry> findById(LookupTable table, int id) {
    return findOne(table, Filters.and(Filters.eq(TABLE_FIELD, table.name()), Filters.eq(table.idColumn(), id)));
  }

  @Override
  public LookupEntry createWithUniqueName(LookupTable table, String name) {
    int id = nextId(table);
    Date now = new Date();
    var doc = new Document()
            .append(TABLE_FIELD, table.name())
            .append(table.idColumn(), id)
            .append(table.nameColumn(), name)
            .append(CREATED_AT_FIELD, now);
    try {
      col.insertOne(doc);
    } catch (MongoWriteException e) {
      if (isDuplicateKey(e) && isNameIndexViolation(e, table)) {
        // The consumed sequence value is left as a gap.
        throw new DuplicateNameException(table.name(), name, e);
      }
      throw new StoreException("Failed to create '" + name + "' in lookup table '" + table.name() + "'", e);
    } catch (MongoException e) {
      throw new StoreException("Failed to create '" + name + "' in lookup table '" + table.name() + "'", e);
    }
    LOG.debug("Created lookup entry {}={} in '{}'", id, name, table.name());
    return LookupEntry.builder().table(table.name()).id(id).name(name).createdAt(now).build();
  }

  @Override
  public List<LookupEntry> findAll(LookupTable table) {
    List<LookupEntry> out = new ArrayList<>();
    try {
      for (var d : col.find(Filters.eq(TABLE_FIELD, table.name())).sort(Sorts.ascending(table.idColumn()))) {
        toEntry(table, d).ifPresent(out::add);
      }
    } catch (MongoException e) {
      throw new StoreException("Failed to read lookup table '" + table.name() + "'", e);
    }
    return out;
  }

  /* ======================== Internals ======================== */

  private Optional<LookupEntry> findOne(LookupTable table, Bson filter) {
    try {
      var d = col.find(filter).limit(1).first();
      return d == null ? Optional.empty() : toEntry(table, d);
    } catch (MongoException e) {
      throw new StoreException("Failed to query lookup table '" + table.name() + "'", e);
    }
  }

  private int nextId(LookupTable table) {
    var opts = new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER);
    try {
      Document counter;
      try {
        counter = counters.findOneAndUpdate(Filters.eq("_id", table.name()), Updates.inc(SEQ_FIELD, 1), opts);
      } catch (MongoServerException e) {
        // Two first-ever upserts of the same counter; the loser's retry finds the document.
        if (ErrorCategory.fromErrorCode(e.getCode()) != ErrorCategory.DUPLICATE_KEY) throw e;
        counter = counters.findOneAndUpdate(Filters.eq("_id", table.name()), Updates.inc(SEQ_FIELD, 1), opts);
      }
      if (counter == null || !(counter.get(SEQ_FIELD) instanceof Number seq)) {
        throw new StoreException("Id counter for lookup table '" + table.name() + "' is missing or malformed");
      }
      return seq.intValue();
    } catch (MongoException e) {
      throw new StoreException("Failed to allocate id for lookup table '" + table.name() + "'", e);
    }
  }

  private static boolean isDuplicateKey(MongoWriteException e) {
    return e.getError() != null && e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY;
  }

  /**
   * Decides which unique index a duplicate-key error hit. Prefers the server's {@code keyPattern}
   * detail and falls back to the exact {@code index: <name>} token of the message. An error that
   * names neither index is treated as a name race; the caller's re-read settles it.
   */
  static boolean isNameIndexViolation(MongoWriteException e, LookupTable table) {
    BsonDocument details = e.getError().getDetails();
    if (details != null && details.get("keyPattern") instanceof BsonDocument keyPattern) {
      return keyPattern.containsKey(table.nameColumn());
    }
    String index = indexFromMessage(e.getError().getMessage());
    return index == null || !index.equals(idIndex(table));
  }

  static String indexFromMessage(String msg) {
    if (msg == null) return null;
    int at = msg.indexOf(INDEX_TOKEN);
    if (at < 0) return null;
    int start = at + INDEX_TOKEN.length();
    int end = msg.indexOf(' ', start);
    return end < 0 ? msg.substring(start) : msg.substring(start, end);
  }

  private Optional<LookupEntry> toEntry(LookupTable table, Document d) {
    var rawId = d.get(table.idColumn());
    var name = d.getString(table.nameColumn());
    if (!(rawId instanceof Number id) || name == null) {
      LOG.warn("Skipping malformed lookup document in '{}': {}", table.name(), d.toJson());
      return Optional.empty();
    }
    var created = d.get(CREATED_AT_FIELD);
    return Optional.of(LookupEntry.builder()
            .table(table.name())
            .id(id.intValue())
            .name(name)
            .createdAt(created instanceof Date dt ? dt : new Date(0))
            .build());
  }
}
