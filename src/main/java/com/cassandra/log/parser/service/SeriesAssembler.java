package com.cassandra.log.parser.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Reconciles partial, possibly sparse series against a sorted and de-duplicated
 * timestamp axis. Gaps are filled with {@link #DEFAULT_VALUE}; values are never reinterpreted.
 */
public class SeriesAssembler {

    public static final double DEFAULT_VALUE = 0.0;

    private SeriesAssembler() {
    }

    /**
     * Builds the aligned result. The axis is the union of the given timestamps and
     * every instant any partial series has a value for.
     *
     * @param timestamps timestamps observed by the extractor, in any order, duplicates allowed
     * @param partialSeries series name to sparse values keyed by instant; iteration order is kept
     * @param metadata producer specific data, copied as is
     */
    public static ParsedTimeSeries assemble(Collection<Instant> timestamps,
            Map<String, ? extends Map<Instant, Double>> partialSeries, Map<String, Object> metadata) {

        List<Instant> axis = axis(timestamps, partialSeries.values());

        Map<String, List<Double>> series = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Map<Instant, Double>> entry : partialSeries.entrySet()) {
            series.put(entry.getKey(), align(axis, entry.getValue()));
        }
        return new ParsedTimeSeries(axis, series, metadata);
    }

    /**
     * Sorted, distinct union of the given timestamps and the instants used by the partial series.
     */
    public static List<Instant> axis(Collection<Instant> timestamps, Collection<? extends Map<Instant, Double>> partials) {
        TreeSet<Instant> sorted = new TreeSet<>();
        for (Instant ts : timestamps) {
            if (ts != null) {
                sorted.add(ts);
            }
        }
        for (Map<Instant, Double> partial : partials) {
            sorted.addAll(partial.keySet());
        }
        return new ArrayList<>(sorted);
    }

    /**
     * One value per axis entry, taken from the sparse map or defaulted.
     */
    public static List<Double> align(List<Instant> axis, Map<Instant, Double> values) {
        List<Double> result = new ArrayList<>(axis.size());
        for (Instant ts : axis) {
            Double value = values.get(ts);
            result.add(value == null || value.isNaN() || value.isInfinite() ? DEFAULT_VALUE : value);
        }
        return result;
    }
}
