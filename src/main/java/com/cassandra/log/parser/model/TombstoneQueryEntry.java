package com.cassandra.log.parser.model;

/**
 * A single tombstone warning: the query that scanned the tombstones and what it read.
 */
public class TombstoneQueryEntry {

    private final String query;
    private final long liveRows;
    private final long tombstones;
    private final double ratio;
    private final String timestamp;
    private final String tableName;

    public TombstoneQueryEntry(String query, long liveRows, long tombstones, String timestamp, String tableName) {
        this.query = query;
        this.liveRows = liveRows;
        this.tombstones = tombstones;
        this.ratio = ratio(liveRows, tombstones);
        this.timestamp = timestamp;
        this.tableName = tableName;
    }

    public static double ratio(long liveRows, long tombstones) {
        long total = liveRows + tombstones;
        return total == 0 ? 0.0 : (double) tombstones / total;
    }

    public String getQuery() {
        return query;
    }

    public long getLiveRows() {
        return liveRows;
    }

    public long getTombstones() {
        return tombstones;
    }

    public double getRatio() {
        return ratio;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public String toString() {
        return String.format("%-30s live=%d tombstones=%d ratio=%.2f %s", tableName, liveRows, tombstones, ratio, query);
    }
}
