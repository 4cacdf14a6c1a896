package com.cassandra.log.config;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the system.log extraction engine.
 * Starts from built-in defaults which can be overridden from a properties file.
 */
public class ParserConfig {

    private static final Logger logger = LoggerFactory.getLogger(ParserConfig.class);

    public static final int DEFAULT_ESTIMATED_GC_DURATION_MS = 100;
    public static final int DEFAULT_TOP_QUERIES = 20;
    public static final int DEFAULT_QUERY_PREVIEW_LENGTH = 100;
    public static final int DEFAULT_TOP_FILES = 5;
    public static final int DEFAULT_MIN_ROW_LENGTH = 3;

    private Set<String> ignorePatterns = new LinkedHashSet<>();
    private Set<String> sectionMarkers = new LinkedHashSet<>();
    private Set<String> skipKeywords = new LinkedHashSet<>();

    private ZoneId zone = ZoneOffset.UTC;
    private long estimatedGcDurationMs = DEFAULT_ESTIMATED_GC_DURATION_MS;
    private int topQueries = DEFAULT_TOP_QUERIES;
    private int queryPreviewLength = DEFAULT_QUERY_PREVIEW_LENGTH;
    private int topFiles = DEFAULT_TOP_FILES;
    private int minRowLength = DEFAULT_MIN_ROW_LENGTH;
    private boolean parallel = false;

    public ParserConfig() {
        initializeDefaults();
    }

    private void initializeDefaults() {
        // Sections that follow the thread pool table in a StatusLogger report
        sectionMarkers.addAll(Arrays.asList(
            "Memtable Metrics",
            "Keyspace Metrics",
            "Cache Type",
            "ColumnFamily",
            "Table",
            "CompactionManager",
            "MessagingService"
        ));

        // Cache and config rows that look like pool rows
        skipKeywords.addAll(Arrays.asList(
            "capacity",
            "keys to save",
            "keystosave",
            "KeyCache",
            "RowCache",
            "CounterCache",
            "ChunkCache"
        ));
    }

    /**
     * Load settings from properties.
     * Supports:
     * - filter.ignore.patterns: comma-separated list (replaces defaults)
     * - filter.ignore.add: comma-separated list (adds to defaults)
     * - filter.ignore.remove: comma-separated list (removes from current set)
     * - parser.threadpool.sectionMarkers / parser.threadpool.skipKeywords: comma-separated lists (replace defaults)
     * - parser.* scalar settings
     */
    public void loadFromProperties(Properties props) {
        String ignoreList = props.getProperty("filter.ignore.patterns");
        if (ignoreList != null && !ignoreList.trim().isEmpty()) {
            ignorePatterns.clear();
            addPatterns(ignorePatterns, ignoreList);
        }

        String additionalPatterns = props.getProperty("filter.ignore.add");
        if (additionalPatterns != null && !additionalPatterns.trim().isEmpty()) {
            addPatterns(ignorePatterns, additionalPatterns);
        }

        String removePatterns = props.getProperty("filter.ignore.remove");
        if (removePatterns != null && !removePatterns.trim().isEmpty()) {
            for (String pattern : removePatterns.split(",")) {
                ignorePatterns.remove(pattern.trim());
            }
        }

        String markers = props.getProperty("parser.threadpool.sectionMarkers");
        if (markers != null && !markers.trim().isEmpty()) {
            sectionMarkers.clear();
            addPatterns(sectionMarkers, markers);
        }

        String keywords = props.getProperty("parser.threadpool.skipKeywords");
        if (keywords != null && !keywords.trim().isEmpty()) {
            skipKeywords.clear();
            addPatterns(skipKeywords, keywords);
        }

        String timezone = props.getProperty("parser.timezone");
        if (timezone != null && !timezone.trim().isEmpty()) {
            try {
                zone = ZoneId.of(timezone.trim());
            } catch (DateTimeException e) {
                logger.warn("Invalid parser.timezone '{}', keeping {}", timezone, zone);
            }
        }

        estimatedGcDurationMs = getLong(props, "parser.gc.estimatedDurationMs", estimatedGcDurationMs);
        topQueries = (int) getLong(props, "parser.tombstone.topQueries", topQueries);
        queryPreviewLength = (int) getLong(props, "parser.tombstone.queryPreviewLength", queryPreviewLength);
        topFiles = (int) getLong(props, "parser.slowreads.topFiles", topFiles);
        minRowLength = (int) getLong(props, "parser.threadpool.minRowLength", minRowLength);

        String parallelValue = props.getProperty("parser.parallel");
        if (parallelValue != null && !parallelValue.trim().isEmpty()) {
            parallel = Boolean.parseBoolean(parallelValue.trim());
        }
    }

    private long getLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 0) {
                logger.warn("Negative value for {}: {}, keeping {}", key, value, defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("Invalid number for {}: {}, keeping {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private void addPatterns(Set<String> target, String patternList) {
        String[] patterns = patternList.split(",");
        for (String pattern : patterns) {
            String trimmed = pattern.trim();
            if (!trimmed.isEmpty()) {
                target.add(trimmed);
            }
        }
    }

    /**
     * True when the trimmed line opens one of the known non thread pool sections.
     */
    public boolean isSectionMarker(String trimmedLine) {
        for (String marker : sectionMarkers) {
            if (trimmedLine.startsWith(marker)
                    && (trimmedLine.length() == marker.length() || Character.isWhitespace(trimmedLine.charAt(marker.length())))) {
                return true;
            }
        }
        return false;
    }

    public boolean shouldIgnore(String line) {
        return !ignorePatterns.isEmpty() && ignorePatterns.stream().anyMatch(line::contains);
    }

    public Set<String> getIgnorePatterns() {
        return new LinkedHashSet<>(ignorePatterns);
    }

    public void addIgnorePattern(String pattern) {
        ignorePatterns.add(pattern);
    }

    public Set<String> getSectionMarkers() {
        return new LinkedHashSet<>(sectionMarkers);
    }

    public Set<String> getSkipKeywords() {
        return new LinkedHashSet<>(skipKeywords);
    }

    public ZoneId getZone() {
        return zone;
    }

    public long getEstimatedGcDurationMs() {
        return estimatedGcDurationMs;
    }

    public void setEstimatedGcDurationMs(long estimatedGcDurationMs) {
        this.estimatedGcDurationMs = estimatedGcDurationMs;
    }

    public int getTopQueries() {
        return topQueries;
    }

    public int getQueryPreviewLength() {
        return queryPreviewLength;
    }

    public int getTopFiles() {
        return topFiles;
    }

    public int getMinRowLength() {
        return minRowLength;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }
}
