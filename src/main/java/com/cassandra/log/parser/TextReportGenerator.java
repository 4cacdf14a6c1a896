package com.cassandra.log.parser;

import java.io.PrintStream;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.cassandra.log.parser.model.DataQuality;
import com.cassandra.log.parser.model.ParsedTimeSeries;
import com.cassandra.log.parser.model.TableTombstoneEntry;
import com.cassandra.log.parser.model.ThreadPoolCategory;
import com.cassandra.log.parser.model.TombstoneQueryEntry;

/**
 * Console summary of one file's results.
 */
public class TextReportGenerator {

    private static final int MAX_ROWS = 10;

    private TextReportGenerator() {
    }

    public static void report(String fileName, SystemLogResult result, PrintStream out) {
        DataQuality quality = result.getDataQuality();
        out.println();
        out.printf("=== %s (%d lines, data quality %d/100) ===%n", fileName, result.getLineCount(), quality.getScore());

        reportGc(result.getGcEvents(), out);
        reportThreadPools(result.getThreadPoolMetrics(), out);
        reportTombstones(result.getTombstoneWarnings(), out);
        reportSlowReads(result.getSlowReads(), out);
        out.printf("Status events: %d%n", quality.getStatusEventCount());
    }

    private static void reportGc(ParsedTimeSeries gc, PrintStream out) {
        if (gc.isEmpty()) {
            out.println("GC events: none");
            return;
        }
        Map<?, ?> stats = (Map<?, ?>) gc.getMetadata("gcStats");
        out.printf("GC events: %s  total %s ms  max %s ms  mean %.1f ms  p95 %.1f ms%n",
                stats.get("count"), stats.get("totalMs"), format(stats.get("maxMs")),
                ((Number) stats.get("meanMs")).doubleValue(), ((Number) stats.get("p95Ms")).doubleValue());
        out.printf("  by generation: %s%n", gc.getMetadata("generationCounts"));
    }

    private static void reportThreadPools(ParsedTimeSeries pools, PrintStream out) {
        if (pools.isEmpty()) {
            out.println("Thread pools: none");
            return;
        }
        List<?> names = (List<?>) pools.getMetadata("threadPools");
        long perCore = names.stream().filter(n -> ThreadPoolCategory.of(n.toString()) == ThreadPoolCategory.PER_CORE).count();
        out.printf("Thread pools: %d (%d per core) over %d reports, layout %s%s%n", names.size(), perCore,
                pools.size(), pools.getMetadata("layout"),
                Boolean.TRUE.equals(pools.getMetadata("degraded")) ? " [degraded]" : "");
    }

    private static void reportTombstones(ParsedTimeSeries tombstones, PrintStream out) {
        if (tombstones.isEmpty()) {
            out.println("Tombstone warnings: none");
            return;
        }
        out.printf("Tombstone warnings: %s%n", tombstones.getMetadata("warningCount"));
        Collection<?> tables = (Collection<?>) tombstones.getMetadata("tableStats");
        tables.stream().limit(MAX_ROWS).forEach(t -> {
            TableTombstoneEntry entry = (TableTombstoneEntry) t;
            out.printf("  %-40s %12d%n", entry.getTableName(), entry.getTombstones());
        });
        Collection<?> queries = (Collection<?>) tombstones.getMetadata("queryData");
        queries.stream().limit(3).forEach(q -> {
            TombstoneQueryEntry entry = (TombstoneQueryEntry) q;
            out.printf("  %8d tombstones / %d live: %s%n", entry.getTombstones(), entry.getLiveRows(), entry.getQuery());
        });
    }

    private static void reportSlowReads(ParsedTimeSeries slowReads, PrintStream out) {
        if (slowReads.isEmpty()) {
            out.println("Timed out reads: none");
            return;
        }
        out.printf("Timed out reads: %s%n", slowReads.getMetadata("totalTimeouts"));
        Map<?, ?> counts = (Map<?, ?>) slowReads.getMetadata("fileCounts");
        counts.entrySet().stream().limit(MAX_ROWS)
                .forEach(e -> out.printf("  %-60s %8s%n", e.getKey(), e.getValue()));
    }

    private static String format(Object value) {
        if (value instanceof Number) {
            return String.valueOf(Math.round(((Number) value).doubleValue()));
        }
        return String.valueOf(value);
    }
}
