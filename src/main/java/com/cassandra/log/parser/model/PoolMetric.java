package com.cassandra.log.parser.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Canonical thread pool metrics reported by StatusLogger and tpstats.
 */
public enum PoolMetric {

    ACTIVE("Active", true),
    PENDING("Pending", true),
    BACKPRESSURE("Backpressure", false),
    DELAYED("Delayed", true),
    SHARED("Shared", false),
    STOLEN("Stolen", false),
    COMPLETED("Completed", true),
    BLOCKED("Blocked", true),
    ALL_TIME_BLOCKED("All Time Blocked", true);

    private final String label;
    private final boolean standard;

    PoolMetric(String label, boolean standard) {
        this.label = label;
        this.standard = standard;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Standard metrics are filled for every pool; the others only when some pool reported them.
     */
    public boolean isStandard() {
        return standard;
    }

    public String seriesKey(String poolName) {
        return poolName + ": " + label;
    }

    public static Set<PoolMetric> standardMetrics() {
        Set<PoolMetric> result = EnumSet.noneOf(PoolMetric.class);
        for (PoolMetric metric : values()) {
            if (metric.standard) {
                result.add(metric);
            }
        }
        return result;
    }

    /**
     * Maps a single lower-cased header word to a metric. Multi-word headers such as
     * "All Time Blocked" are resolved by the header parser before this is called.
     */
    public static PoolMetric fromHeaderWord(String word) {
        String w = word.toLowerCase(Locale.ROOT);
        if (w.contains("alltimeblocked") || w.contains("all-time-blocked") || w.contains("all_time_blocked")) {
            return ALL_TIME_BLOCKED;
        }
        if (w.contains("active")) {
            return ACTIVE;
        }
        if (w.contains("backpressure")) {
            return BACKPRESSURE;
        }
        if (w.contains("pending")) {
            return PENDING;
        }
        if (w.contains("delayed")) {
            return DELAYED;
        }
        if (w.contains("shared")) {
            return SHARED;
        }
        if (w.contains("stolen")) {
            return STOLEN;
        }
        if (w.contains("completed")) {
            return COMPLETED;
        }
        if (w.contains("blocked")) {
            return BLOCKED;
        }
        return null;
    }
}
