package com.cassandra.log.parser.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time series extracted from a log: a shared timestamp axis, named value series
 * aligned to it, and free-form metadata that is not indexed by time.
 * <p>
 * Every series holds exactly one value per timestamp. Instances are immutable.
 */
public class ParsedTimeSeries {

    private static final ParsedTimeSeries EMPTY =
            new ParsedTimeSeries(Collections.emptyList(), Collections.emptyMap(), Collections.emptyMap());

    private final List<Instant> timestamps;
    private final Map<String, List<Double>> series;
    private final Map<String, Object> metadata;

    public ParsedTimeSeries(List<Instant> timestamps, Map<String, List<Double>> series, Map<String, Object> metadata) {
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));

        Map<String, List<Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : series.entrySet()) {
            List<Double> values = entry.getValue();
            if (values.size() != this.timestamps.size()) {
                throw new IllegalArgumentException(String.format("Series '%s' has %d values for %d timestamps",
                        entry.getKey(), values.size(), this.timestamps.size()));
            }
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(values)));
        }
        this.series = Collections.unmodifiableMap(copy);

        for (int i = 1; i < this.timestamps.size(); i++) {
            if (!this.timestamps.get(i - 1).isBefore(this.timestamps.get(i))) {
                throw new IllegalArgumentException("Timestamps must be strictly ascending at index " + i);
            }
        }

        this.metadata = metadata == null ? Collections.emptyMap() : freezeMap(metadata);
    }

    /**
     * Copies metadata into unmodifiable collections, nested lists and maps included.
     * Map order is kept.
     */
    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map) {
            return freezeMap((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>(((Collection<?>) value).size());
            for (Object element : (Collection<?>) value) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static ParsedTimeSeries empty() {
        return EMPTY;
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }

    public Map<String, List<Double>> getSeries() {
        return series;
    }

    public List<Double> getSeries(String name) {
        return series.get(name);
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Object getMetadata(String key) {
        return metadata.get(key);
    }

    public int size() {
        return timestamps.size();
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    /**
     * Value of the named series at the given timestamp, or null when either is unknown.
     */
    public Double valueAt(String name, Instant timestamp) {
        List<Double> values = series.get(name);
        if (values == null) {
            return null;
        }
        int index = Collections.binarySearch(timestamps, timestamp);
        return index < 0 ? null : values.get(index);
    }

    @Override
    public String toString() {
        return String.format("ParsedTimeSeries[timestamps=%d, series=%d, metadata=%s]",
                timestamps.size(), series.size(), metadata.keySet());
    }
}
