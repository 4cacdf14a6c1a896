package com.cassandra.log.parser.model;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Summary of what was found in one log: which event families are present, how many
 * events each produced and a coarse score of 25 per present family.
 */
public class DataQuality {

    public static final int POINTS_PER_FAMILY = 25;

    private final boolean hasGcEvents;
    private final boolean hasThreadPools;
    private final boolean hasTombstones;
    private final boolean hasSlowReads;
    private final long gcEventCount;
    private final int threadPoolCount;
    private final long tombstoneWarningCount;
    private final long slowReadCount;
    private final long statusEventCount;
    private final int totalTimestamps;

    public DataQuality(ParsedTimeSeries gcEvents, ParsedTimeSeries threadPools, ParsedTimeSeries tombstones,
            ParsedTimeSeries slowReads, ParsedTimeSeries statusEvents) {
        this.hasGcEvents = !gcEvents.isEmpty();
        this.hasThreadPools = !threadPools.isEmpty();
        this.hasTombstones = !tombstones.isEmpty();
        this.hasSlowReads = !slowReads.isEmpty();
        this.gcEventCount = nestedCount(gcEvents.getMetadata("gcStats"), "count");
        Object pools = threadPools.getMetadata("threadPools");
        this.threadPoolCount = pools instanceof Collection ? ((Collection<?>) pools).size() : 0;
        this.tombstoneWarningCount = count(tombstones.getMetadata("warningCount"));
        this.slowReadCount = count(slowReads.getMetadata("totalTimeouts"));
        this.statusEventCount = count(statusEvents.getMetadata("totalEvents"));

        TreeSet<Instant> all = new TreeSet<>();
        for (ParsedTimeSeries result : List.of(gcEvents, threadPools, tombstones, slowReads, statusEvents)) {
            all.addAll(result.getTimestamps());
        }
        this.totalTimestamps = all.size();
    }

    private static long count(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static long nestedCount(Object map, String key) {
        return map instanceof Map ? count(((Map<?, ?>) map).get(key)) : 0L;
    }

    public boolean hasGcEvents() {
        return hasGcEvents;
    }

    public boolean hasThreadPools() {
        return hasThreadPools;
    }

    public boolean hasTombstones() {
        return hasTombstones;
    }

    public boolean hasSlowReads() {
        return hasSlowReads;
    }

    public long getGcEventCount() {
        return gcEventCount;
    }

    public int getThreadPoolCount() {
        return threadPoolCount;
    }

    public long getTombstoneWarningCount() {
        return tombstoneWarningCount;
    }

    public long getSlowReadCount() {
        return slowReadCount;
    }

    public long getStatusEventCount() {
        return statusEventCount;
    }

    /** Distinct instants across all result families. */
    public int getTotalTimestamps() {
        return totalTimestamps;
    }

    public int getScore() {
        int score = 0;
        if (hasGcEvents) {
            score += POINTS_PER_FAMILY;
        }
        if (hasThreadPools) {
            score += POINTS_PER_FAMILY;
        }
        if (hasTombstones) {
            score += POINTS_PER_FAMILY;
        }
        if (hasSlowReads) {
            score += POINTS_PER_FAMILY;
        }
        return score;
    }

    @Override
    public String toString() {
        return "DataQuality[score=" + getScore() + ", gc=" + gcEventCount + ", pools=" + threadPoolCount
                + ", tombstones=" + tombstoneWarningCount + ", slowReads=" + slowReadCount + "]";
    }
}
