package com.siva.lookup.repo;

import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteError;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.siva.lookup.configuration.LookupTable;
import com.siva.lookup.exception.DuplicateNameException;
import com.siva.lookup.exception.StoreException;
import com.siva.lookup.model.LookupEntry;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class MongoLookupStoreTest {

  private static final LookupTable CAR_TYPES = LookupTable.of("car_types");
  private static final LookupTable COLORS = new LookupTable("colors", "color_id", "label");

  private MongoCollection<Document> col;
  private MongoCollection<Document> counters;
  private FindIterable<Document> found;
  private MongoLookupStore store;

  @BeforeEach
  void setUp() {
    col = mock(MongoCollection.class);
    counters = mock(MongoCollection.class);
    found = mock(FindIterable.class);
    when(col.find(any(Bson.class))).thenReturn(found);
    when(found.limit(1)).thenReturn(found);
    when(found.sort(any(Bson.class))).thenReturn(found);
    store = new MongoLookupStore(col, counters);
  }

  @Test
  void ensureIndexesCreatesUniqueNameAndIdIndexes() {
    store.ensureIndexes(COLORS);

    var opts = ArgumentCaptor.forClass(IndexOptions.class);
    verify(col, times(2)).createIndex(any(Bson.class), opts.capture());
    assertThat(opts.getAllValues()).allMatch(IndexOptions::isUnique);
    assertThat(opts.getAllValues()).extracting(IndexOptions::getName)
            .containsExactly("uniq_6_colors_label", "uniq_6_colors_color_id");
  }

  @Test
  void findByNameMapsTheConfiguredColumns() {
    Date created = new Date(1_700_000_000_000L);
    when(found.first()).thenReturn(new Document("table", "colors")
            .append("color_id", 3).append("label", "Red").append("createdAt", created));

    var entry = store.findByName(COLORS, "Red");

    assertThat(entry).contains(LookupEntry.builder().table("colors").id(3).name("Red").createdAt(created).build());
  }

  @Test
  void findByIdReturnsEmptyWhenMissing() {
    when(found.first()).thenReturn(null);

    assertThat(store.findById(CAR_TYPES, 99)).isEmpty();
  }

  @Test
  void readFailuresBecomeStoreErrors() {
    when(found.first()).thenThrow(new MongoTimeoutException("timed out"));

    assertThatThrownBy(() -> store.findByName(CAR_TYPES, "Sports"))
            .isInstanceOf(StoreException.class)
            .hasCauseInstanceOf(MongoTimeoutException.class);
  }

  @Test
  void createTakesTheNextSequenceValue() {
    when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenReturn(new Document("_id", "car_types").append("seq", 1));

    var entry = store.createWithUniqueName(CAR_TYPES, "Sports");

    assertThat(entry.getId()).isEqualTo(1);
    assertThat(entry.getName()).isEqualTo("Sports");
    var inserted = ArgumentCaptor.forClass(Document.class);
    verify(col).insertOne(inserted.capture());
    assertThat(inserted.getValue().getString("table")).isEqualTo("car_types");
    assertThat(inserted.getValue().getInteger("id")).isEqualTo(1);
    assertThat(inserted.getValue().getString("name")).isEqualTo("Sports");
    assertThat(inserted.getValue().get("createdAt")).isInstanceOf(Date.class);
  }

  @Test
  void duplicateNameIsReportedAsDuplicate() {
    when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenReturn(new Document("_id", "car_types").append("seq", 2));
    doThrow(duplicateKey(MongoLookupStore.nameIndex(CAR_TYPES))).when(col).insertOne(any(Document.class));

    assertThatThrownBy(() -> store.createWithUniqueName(CAR_TYPES, "Sports"))
            .isInstanceOf(DuplicateNameException.class)
            .hasCauseInstanceOf(MongoWriteException.class);
  }

  @Test
  void duplicateIdIsAStoreError() {
    when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenReturn(new Document("_id", "car_types").append("seq", 2));
    doThrow(duplicateKey(MongoLookupStore.idIndex(CAR_TYPES))).when(col).insertOne(any(Document.class));

    assertThatThrownBy(() -> store.createWithUniqueName(CAR_TYPES, "Sports"))
            .isInstanceOf(StoreException.class)
            .isNotInstanceOf(DuplicateNameException.class);
  }

  @Test
  void counterUpsertRaceIsRetriedOnce() {
    when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenThrow(duplicateKey("_id_"))
            .thenReturn(new Document("_id", "car_types").append("seq", 1));

    assertThat(store.createWithUniqueName(CAR_TYPES, "Sports").getId()).isEqualTo(1);
  }

  @Test
  void counterFailureStopsBeforeInsert() {
    when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenThrow(new MongoTimeoutException("timed out"));

    assertThatThrownBy(() -> store.createWithUniqueName(CAR_TYPES, "Sports")).isInstanceOf(StoreException.class);
    verify(col, never()).insertOne(any(Document.class));
  }

  @Test
  void findAllSkipsMalformedDocuments() {
    MongoCursor<Document> cursor = mock(MongoCursor.class);
    when(found.iterator()).thenReturn(cursor);
    when(cursor.hasNext()).thenReturn(true, true, true, false);
    when(cursor.next()).thenReturn(
            new Document("table", "car_types").append("id", 1).append("name", "Sports"),
            new Document("table", "car_types").append("id", "oops").append("name", "Broken"),
            new Document("table", "car_types").append("id", 2L).append("name", "Compact"));

    List<LookupEntry> all = store.findAll(CAR_TYPES);

    assertThat(all).extracting(LookupEntry::getId).containsExactly(1, 2);
    assertThat(all).extracting(LookupEntry::getName).containsExactly("Sports", "Compact");
  }

  @Test
  void nameRaceIsRecognisedWhenIdIndexNameIsAPrefix() {
    var codes = new LookupTable("t", "code", "code_label");
    when(counters.findOneAndUpdate(any(Bson.class), any(Bson.class), any(FindOneAndUpdateOptions.class)))
            .thenReturn(new Document("_id", "t").append("seq", 5));
    doThrow(duplicateKey(MongoLookupStore.nameIndex(codes))).when(col).insertOne(any(Document.class));

    assertThat(MongoLookupStore.nameIndex(codes)).startsWith(MongoLookupStore.idIndex(codes));
    assertThatThrownBy(() -> store.createWithUniqueName(codes, "X")).isInstanceOf(DuplicateNameException.class);
  }

  @Test
  void indexNamesDoNotCollideAcrossTables() {
    var a = new LookupTable("car", "id", "types_name");
    var b = new LookupTable("car_types", "id", "name");

    assertThat(MongoLookupStore.nameIndex(a)).isNotEqualTo(MongoLookupStore.nameIndex(b));
    assertThat(MongoLookupStore.idIndex(a)).isNotEqualTo(MongoLookupStore.idIndex(b));
  }

  @Test
  void keyPatternDetailDecidesWhichIndexWasHit() {
    var byName = duplicateKey("ignored", new BsonDocument("keyPattern",
            new BsonDocument("table", new BsonInt32(1)).append("name", new BsonInt32(1))));
    var byId = duplicateKey("ignored", new BsonDocument("keyPattern",
            new BsonDocument("table", new BsonInt32(1)).append("id", new BsonInt32(1))));

    assertThat(MongoLookupStore.isNameIndexViolation(byName, CAR_TYPES)).isTrue();
    assertThat(MongoLookupStore.isNameIndexViolation(byId, CAR_TYPES)).isFalse();
  }

  @Test
  void extractsTheExactIndexToken() {
    assertThat(MongoLookupStore.indexFromMessage(
            "E11000 duplicate key error collection: lookup.lookup_entries index: uniq_1_t_code dup key: { }"))
            .isEqualTo("uniq_1_t_code");
    assertThat(MongoLookupStore.indexFromMessage("E11000 duplicate key error")).isNull();
    assertThat(MongoLookupStore.indexFromMessage(null)).isNull();
  }

  private static MongoWriteException duplicateKey(String index) {
    return duplicateKey(index, new BsonDocument());
  }

  @SuppressWarnings("deprecation")
  private static MongoWriteException duplicateKey(String index, BsonDocument details) {
    var error = new WriteError(11000,
            "E11000 duplicate key error collection: lookup.lookup_entries index: " + index + " dup key: { }", details);
    return new MongoWriteException(error, new ServerAddress());
  }
}
