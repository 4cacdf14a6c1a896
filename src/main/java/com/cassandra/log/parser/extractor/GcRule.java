package com.cassandra.log.parser.extractor;

import java.util.regex.Pattern;

/**
 * GCInspector line patterns in the order they are tried. Earlier rules are stricter;
 * the fallbacks loosen how the timestamp and duration are located.
 */
public enum GcRule {

    /** {@code INFO  [GCInspector:1] 2023-06-15 10:15:23,456 GCInspector.java:284 - G1 Young Generation GC in 250ms} */
    PRIMARY(Pattern.compile(
            "INFO\\s+\\[GCInspector:\\d+\\]\\s+(\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2},\\d{3})\\s+GCInspector\\.java:\\d+\\s+-\\s+(.*)\\s+in\\s+(\\d+)ms"),
            1, 3, 2, false),

    /** {@code INFO  [Service Thread] 2019-01-01 10:00:00,000 GCInspector.java:258 - ParNew GC in 312ms. CMS Old Gen: ...} */
    YOUNG_GENERATION(Pattern.compile(
            "\\[[^\\]]*\\]\\s+(\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2}(?:[,.]\\d{1,9})?)\\s+GCInspector\\.java:\\d+\\s+-\\s+"
                    + "((?:ParNew|G1 Young Generation|PS Scavenge|Copy)(?:\\s+GC)?)\\s+in\\s+(\\d+)ms"),
            1, 3, 2, false),

    /** {@code WARN  [Service Thread] 2019-01-01 10:00:00,000 GCInspector.java:282 - ConcurrentMarkSweep GC in 1283ms.} */
    OLD_GENERATION(Pattern.compile(
            "\\[[^\\]]*\\]\\s+(\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2}(?:[,.]\\d{1,9})?)\\s+GCInspector\\.java:\\d+\\s+-\\s+"
                    + "((?:ConcurrentMarkSweep|G1 Old Generation|G1 Full|PS MarkSweep|MarkSweepCompact)(?:\\s+GC)?|Full GC)\\s+in\\s+(\\d+)ms"),
            1, 3, 2, false),

    /** Bracketed GCInspector thread, timestamp without milliseconds, anything up to "in Nms". */
    FALLBACK_BRACKETED(Pattern.compile(
            "\\[GCInspector.*?\\]\\s+(\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2}).*?in\\s+(\\d+)ms"),
            1, 2, 0, false),

    /** Source file tag followed by any duration token; timestamp anywhere on the line. */
    FALLBACK_SOURCE_TAG(Pattern.compile(
            "GCInspector\\.java:\\d+.*?(?<![\\d.])(\\d+)\\s*ms\\b"),
            0, 1, 0, false),

    /** Any duration token on a GCInspector line; timestamp from the line or the last one seen. */
    FALLBACK_ANY_DURATION(Pattern.compile(
            "(?<![\\d.])(\\d+)\\s*ms\\b"),
            0, 1, 0, true),

    /** Tag and "ms" present but no readable duration: the configured estimate is recorded instead. */
    ESTIMATED(null, 0, 0, 0, true);

    private final Pattern pattern;
    private final int timestampGroup;
    private final int durationGroup;
    private final int descriptionGroup;
    private final boolean contextTimestampAllowed;

    GcRule(Pattern pattern, int timestampGroup, int durationGroup, int descriptionGroup, boolean contextTimestampAllowed) {
        this.pattern = pattern;
        this.timestampGroup = timestampGroup;
        this.durationGroup = durationGroup;
        this.descriptionGroup = descriptionGroup;
        this.contextTimestampAllowed = contextTimestampAllowed;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /** Group holding the timestamp, 0 when the timestamp is searched on the whole line. */
    public int getTimestampGroup() {
        return timestampGroup;
    }

    /** Group holding the duration, 0 when the duration is estimated. */
    public int getDurationGroup() {
        return durationGroup;
    }

    /** Group holding the GC description, 0 when the line itself is the description. */
    public int getDescriptionGroup() {
        return descriptionGroup;
    }

    public boolean isContextTimestampAllowed() {
        return contextTimestampAllowed;
    }

    public boolean isFallback() {
        return ordinal() >= FALLBACK_BRACKETED.ordinal();
    }
}
