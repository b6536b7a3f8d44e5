package com.siva.lookup.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "lookup")
public class LookupProperties {

    public enum StoreType { MONGO, MEMORY }

    private StoreType store = StoreType.MONGO;
    private String collection = "lookup_entries";
    private String countersCollection = "lookup_counters";
    private List<TableDefinition> tables = new ArrayList<>();
    private boolean preload = true;
    private int warnSize = 10_000;

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public String getCountersCollection() {
        return countersCollection;
    }

    public void setCountersCollection(String countersCollection) {
        this.countersCollection = countersCollection;
    }

    public List<TableDefinition> getTables() {
        return tables;
    }

    public void setTables(List<TableDefinition> tables) {
        this.tables = tables;
    }

    public boolean isPreload() {
        return preload;
    }

    public void setPreload(boolean preload) {
        this.preload = preload;
    }

    public int getWarnSize() {
        return warnSize;
    }

    public void setWarnSize(int warnSize) {
        this.warnSize = warnSize;
    }

    /** Configured tables as immutable {@link LookupTable} values. */
    public List<LookupTable> lookupTables() {
        return tables.stream()
                .map(t -> new LookupTable(t.getName(), t.getIdColumn(), t.getNameColumn()))
                .toList();
    }

    public static class TableDefinition {

        private String name;
        private String idColumn;
        private String nameColumn;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getIdColumn() {
            return idColumn;
        }

        public void setIdColumn(String idColumn) {
            this.idColumn = idColumn;
        }

        public String getNameColumn() {
            return nameColumn;
        }

        public void setNameColumn(String nameColumn) {
            this.nameColumn = nameColumn;
        }
    }
}
