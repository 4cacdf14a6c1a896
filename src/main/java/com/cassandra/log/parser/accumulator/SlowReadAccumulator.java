package com.cassandra.log.parser.accumulator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.cassandra.log.parser.model.ParsedTimeSeries;
import com.cassandra.log.parser.service.SeriesAssembler;

/**
 * Counts timed out reads per instant and per data file.
 */
public class SlowReadAccumulator {

    public static final String TIMED_OUT_SERIES = "Timed Out Reads";
    public static final String FILE_SERIES_PREFIX = "File: ";

    private final TreeMap<Instant, Double> timeouts = new TreeMap<>();
    private final Map<String, TreeMap<Instant, Double>> fileTimeouts = new LinkedHashMap<>();
    private final Map<String, Long> fileCounts = new LinkedHashMap<>();
    private long total;

    public void accumulate(Instant timestamp, String filePath) {
        if (timestamp == null) {
            return;
        }
        String key = fileKey(filePath);
        timeouts.merge(timestamp, 1.0, Double::sum);
        fileTimeouts.computeIfAbsent(key, k -> new TreeMap<>()).merge(timestamp, 1.0, Double::sum);
        fileCounts.merge(key, 1L, Long::sum);
        total++;
    }

    /**
     * Groups SSTable paths by their last two segments (table directory and file name).
     */
    public static String fileKey(String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            return "unknown";
        }
        String[] parts = filePath.split("/");
        List<String> segments = new ArrayList<>();
        for (String part : parts) {
            if (!part.isEmpty()) {
                segments.add(part);
            }
        }
        if (segments.isEmpty()) {
            return filePath;
        }
        int from = Math.max(0, segments.size() - 2);
        return String.join("/", segments.subList(from, segments.size()));
    }

    public long getTotal() {
        return total;
    }

    public boolean hasTimeouts() {
        return total > 0;
    }

    /**
     * File keys with their counts, highest first. Equal counts keep encounter order.
     */
    public Map<String, Long> getFileCounts() {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(fileCounts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed());
        Map<String, Long> result = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : entries) {
            result.put(entry.getKey(), entry.getValue());
        }
        return result;
    }

    public ParsedTimeSeries toTimeSeries(int topFiles) {
        if (!hasTimeouts()) {
            return ParsedTimeSeries.empty();
        }
        Map<String, Long> sortedCounts = getFileCounts();

        Map<String, TreeMap<Instant, Double>> partial = new LinkedHashMap<>();
        partial.put(TIMED_OUT_SERIES, timeouts);
        sortedCounts.keySet().stream()
                .limit(topFiles)
                .forEach(key -> partial.put(FILE_SERIES_PREFIX + key, fileTimeouts.get(key)));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fileCounts", sortedCounts);
        metadata.put("totalTimeouts", total);

        return SeriesAssembler.assemble(timeouts.keySet(), partial, metadata);
    }
}
