package com.cassandra.log.parser;

import com.cassandra.log.config.ParserConfig;

/**
 * Routes a line to at most one extractor using substring checks only, so that
 * regular expressions are evaluated just for candidate lines.
 */
public class LineClassifier {

    public static final String GC_INSPECTOR = "GCInspector";
    public static final String STATUS_LOGGER = "StatusLogger.java";
    public static final String READ_COMMAND = "ReadCommand.java";
    public static final String SLICE_QUERY_FILTER = "SliceQueryFilter.java";
    public static final String TOMBSTONE = "tombstone";
    public static final String TIMED_OUT_READ = "Timed out async read";

    private final ParserConfig config;

    public LineClassifier(ParserConfig config) {
        this.config = config;
    }

    public LineCategory classify(String line) {
        if (line == null || line.isEmpty() || config.shouldIgnore(line)) {
            return LineCategory.NONE;
        }
        if (line.contains(GC_INSPECTOR)) {
            return LineCategory.GC_EVENT;
        }
        if (line.contains(STATUS_LOGGER)) {
            return LineCategory.STATUS_LOGGER;
        }
        if (line.contains(TOMBSTONE) && (line.contains(READ_COMMAND) || line.contains(SLICE_QUERY_FILTER))) {
            return LineCategory.TOMBSTONE_WARNING;
        }
        if (line.contains(TIMED_OUT_READ)) {
            return LineCategory.SLOW_READ;
        }
        if (config.isSectionMarker(line.trim())) {
            return LineCategory.SECTION_MARKER;
        }
        return LineCategory.NONE;
    }

    public boolean is(String line, LineCategory category) {
        return classify(line) == category;
    }
}
