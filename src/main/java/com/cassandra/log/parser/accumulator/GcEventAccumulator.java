package com.cassandra.log.parser.accumulator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.cassandra.log.parser.model.GcGeneration;
import com.cassandra.log.parser.model.ParsedTimeSeries;
import com.cassandra.log.parser.service.SeriesAssembler;

/**
 * Collects GC pauses. Pauses landing on the same instant are summed; the generation
 * tag of the first pause at an instant is kept.
 */
public class GcEventAccumulator {

    public static final String DURATION_SERIES = "GC Duration (ms)";

    private static final int MAX_RAW_DESCRIPTIONS = 1000;

    private final TreeMap<Instant, Double> durations = new TreeMap<>();
    private final TreeMap<Instant, GcGeneration> generations = new TreeMap<>();
    private final List<String> rawDescriptions = new ArrayList<>();
    private final Map<String, AtomicLong> ruleCounts = new LinkedHashMap<>();
    private final Map<GcGeneration, AtomicLong> generationCounts = new EnumMap<>(GcGeneration.class);

    private final DescriptiveStatistics durationStats = new DescriptiveStatistics();
    private long eventCount;
    private long totalDurationMs;

    public void accumulate(Instant timestamp, long durationMs, GcGeneration generation, String rule, String description) {
        if (timestamp == null) {
            return;
        }
        durations.merge(timestamp, (double) durationMs, Double::sum);
        generations.putIfAbsent(timestamp, generation);

        ruleCounts.computeIfAbsent(rule, k -> new AtomicLong()).incrementAndGet();
        generationCounts.computeIfAbsent(generation, k -> new AtomicLong()).incrementAndGet();

        if (rawDescriptions.size() < MAX_RAW_DESCRIPTIONS) {
            rawDescriptions.add(description);
        }
        durationStats.addValue(durationMs);
        eventCount++;
        totalDurationMs += durationMs;
    }

    public long getEventCount() {
        return eventCount;
    }

    public boolean hasEvents() {
        return eventCount > 0;
    }

    public long getRuleCount(String rule) {
        AtomicLong count = ruleCounts.get(rule);
        return count == null ? 0 : count.get();
    }

    public ParsedTimeSeries toTimeSeries() {
        if (!hasEvents()) {
            return ParsedTimeSeries.empty();
        }
        Map<String, TreeMap<Instant, Double>> partial = new LinkedHashMap<>();
        partial.put(DURATION_SERIES, durations);

        List<String> gcTypes = new ArrayList<>(generations.size());
        for (GcGeneration generation : generations.values()) {
            gcTypes.add(generation.getTag());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("gcTypes", gcTypes);
        metadata.put("rawDescriptions", new ArrayList<>(rawDescriptions));
        metadata.put("ruleCounts", counts(ruleCounts));
        Map<String, Long> byGeneration = new LinkedHashMap<>();
        for (GcGeneration generation : GcGeneration.values()) {
            AtomicLong count = generationCounts.get(generation);
            byGeneration.put(generation.getTag(), count == null ? 0L : count.get());
        }
        metadata.put("generationCounts", byGeneration);
        metadata.put("gcStats", stats());

        return SeriesAssembler.assemble(durations.keySet(), partial, metadata);
    }

    private Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("count", eventCount);
        stats.put("totalMs", totalDurationMs);
        stats.put("minMs", durationStats.getMin());
        stats.put("maxMs", durationStats.getMax());
        stats.put("meanMs", durationStats.getMean());
        stats.put("p95Ms", durationStats.getPercentile(95));
        stats.put("p99Ms", durationStats.getPercentile(99));
        return stats;
    }

    private static Map<String, Long> counts(Map<String, AtomicLong> source) {
        Map<String, Long> result = new LinkedHashMap<>();
        source.forEach((k, v) -> result.put(k, v.get()));
        return result;
    }
}
