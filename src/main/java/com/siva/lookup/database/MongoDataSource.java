package com.siva.lookup.database;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.siva.lookup.exception.StoreException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;

import java.io.Closeable;

/**
 * Owns the Mongo client used by the lookup store. Location comes from
 * {@code MONGODB_URI} / {@code MONGODB_DB}.
 */
public class MongoDataSource implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(MongoDataSource.class);

    static final String DEFAULT_MONGO_URI = "mongodb://localhost:27017/";
    static final String DEFAULT_DATABASE_NAME = "lookup";

    private final String uri;
    private final String databaseName;

    protected MongoClient mongoClient;
    protected MongoDatabase database;

    public MongoDataSource() {
        this(getenvOrDefault("MONGODB_URI", DEFAULT_MONGO_URI),
             getenvOrDefault("MONGODB_DB", DEFAULT_DATABASE_NAME));
    }

    public MongoDataSource(String uri, String databaseName) {
        this.uri = uri;
        this.databaseName = databaseName;
        this.mongoClient = MongoClients.create(uri);
        this.database = mongoClient.getDatabase(databaseName);
        LOG.info("Mongo data source configured for database '{}'", databaseName);
    }

    public MongoCollection<Document> getCollection(String collectionName) {
        if (this.database == null || !isConnectionAlive()) reconnect();
        return database.getCollection(collectionName);
    }

    private boolean isConnectionAlive() {
        try {
            if (this.database == null) return false;
            this.database.runCommand(new Document("ping", 1));
            return true;
        } catch (MongoException e) {
            LOG.debug("Mongo ping failed for database '{}'", databaseName, e);
            return false;
        }
    }

    private synchronized void reconnect() {
        try {
            if (this.mongoClient == null) {
                this.mongoClient = MongoClients.create(uri);
            }
            this.database = new SimpleMongoClientDatabaseFactory(this.mongoClient, databaseName).getMongoDatabase();
        } catch (RuntimeException e) {
            throw new StoreException("Unable to open Mongo database '" + databaseName + "'", e);
        }
    }

    private static String getenvOrDefault(String key, String def) {
        try {
            String v = System.getenv(key);
            return (v == null || v.isBlank()) ? def : v;
        } catch (SecurityException se) {
            return def;
        }
    }

    @Override
    public void close() {
        if (mongoClient != null) {
            mongoClient.close();
            mongoClient = null;
            database = null;
        }
    }
}
