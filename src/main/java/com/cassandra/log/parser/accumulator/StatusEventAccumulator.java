package com.cassandra.log.parser.accumulator;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import com.cassandra.log.parser.model.ParsedTimeSeries;
import com.cassandra.log.parser.service.SeriesAssembler;

/**
 * Counts StatusLogger lines per instant.
 */
public class StatusEventAccumulator {

    public static final String STATUS_SERIES = "Status Events";

    private final TreeMap<Instant, Double> events = new TreeMap<>();
    private final Map<String, Long> threadCounts = new LinkedHashMap<>();
    private long total;

    public void accumulate(Instant timestamp, String thread) {
        if (timestamp == null) {
            return;
        }
        events.merge(timestamp, 1.0, Double::sum);
        if (thread != null) {
            threadCounts.merge(thread, 1L, Long::sum);
        }
        total++;
    }

    public long getTotal() {
        return total;
    }

    public ParsedTimeSeries toTimeSeries() {
        if (total == 0) {
            return ParsedTimeSeries.empty();
        }
        Map<String, TreeMap<Instant, Double>> partial = new LinkedHashMap<>();
        partial.put(STATUS_SERIES, events);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("totalEvents", total);
        metadata.put("threads", new LinkedHashMap<>(threadCounts));
        return SeriesAssembler.assemble(events.keySet(), partial, metadata);
    }
}
