package com.cassandra.log.parser.accumulator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.cassandra.log.parser.model.ParsedTimeSeries;
import com.cassandra.log.parser.model.TableTombstoneEntry;
import com.cassandra.log.parser.model.TombstoneQueryEntry;
import com.cassandra.log.parser.service.SeriesAssembler;

/**
 * Accumulates tombstone warnings per instant and per table.
 */
public class TombstoneAccumulator {

    public static final String LIVE_ROWS_SERIES = "Live Rows";
    public static final String TOMBSTONE_CELLS_SERIES = "Tombstone Cells";
    public static final String RATIO_SERIES = "Tombstone Ratio";
    public static final String UNKNOWN_TABLE = "Unknown";

    private final TreeMap<Instant, Double> liveRows = new TreeMap<>();
    private final TreeMap<Instant, Double> tombstoneCells = new TreeMap<>();
    private final List<TombstoneQueryEntry> queries = new ArrayList<>();
    private final Map<String, Long> tableStats = new LinkedHashMap<>();

    public void accumulate(Instant timestamp, long live, long tombstones, String query, String tableName) {
        if (timestamp == null) {
            return;
        }
        String table = tableName == null || tableName.isEmpty() ? UNKNOWN_TABLE : tableName;

        liveRows.merge(timestamp, (double) live, Double::sum);
        tombstoneCells.merge(timestamp, (double) tombstones, Double::sum);
        tableStats.merge(table, tombstones, Long::sum);
        queries.add(new TombstoneQueryEntry(query, live, tombstones, timestamp.toString(), table));
    }

    public boolean hasWarnings() {
        return !queries.isEmpty();
    }

    public int getWarningCount() {
        return queries.size();
    }

    /**
     * Queries ordered by tombstone count, highest first. Equal counts keep encounter order.
     */
    public List<TombstoneQueryEntry> getTopQueries(int limit) {
        List<TombstoneQueryEntry> sorted = new ArrayList<>(queries);
        sorted.sort(Comparator.comparingLong(TombstoneQueryEntry::getTombstones).reversed());
        return new ArrayList<>(sorted.subList(0, Math.min(limit, sorted.size())));
    }

    public List<TableTombstoneEntry> getTableStats() {
        List<TableTombstoneEntry> result = new ArrayList<>();
        tableStats.forEach((table, total) -> result.add(new TableTombstoneEntry(table, total)));
        result.sort(Comparator.comparingLong(TableTombstoneEntry::getTombstones).reversed());
        return result;
    }

    public ParsedTimeSeries toTimeSeries(int topQueries) {
        if (!hasWarnings()) {
            return ParsedTimeSeries.empty();
        }
        TreeMap<Instant, Double> ratios = new TreeMap<>();
        for (Map.Entry<Instant, Double> entry : tombstoneCells.entrySet()) {
            long tombstones = entry.getValue().longValue();
            long live = liveRows.getOrDefault(entry.getKey(), 0.0).longValue();
            ratios.put(entry.getKey(), TombstoneQueryEntry.ratio(live, tombstones));
        }

        Map<String, TreeMap<Instant, Double>> partial = new LinkedHashMap<>();
        partial.put(LIVE_ROWS_SERIES, liveRows);
        partial.put(TOMBSTONE_CELLS_SERIES, tombstoneCells);
        partial.put(RATIO_SERIES, ratios);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("queryData", getTopQueries(topQueries));
        metadata.put("tableStats", getTableStats());
        metadata.put("warningCount", queries.size());

        return SeriesAssembler.assemble(tombstoneCells.keySet(), partial, metadata);
    }
}
