package com.cassandra.log.parser.model;

/**
 * Total tombstones read from one table across all warnings.
 */
public class TableTombstoneEntry {

    private final String tableName;
    private final long tombstones;

    public TableTombstoneEntry(String tableName, long tombstones) {
        this.tableName = tableName;
        this.tombstones = tombstones;
    }

    public String getTableName() {
        return tableName;
    }

    public long getTombstones() {
        return tombstones;
    }

    @Override
    public String toString() {
        return tableName + "=" + tombstones;
    }
}
