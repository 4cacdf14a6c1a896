package com.cassandra.log.parser.accumulator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.cassandra.log.parser.model.ParsedTimeSeries;
import com.cassandra.log.parser.model.PoolMetric;
import com.cassandra.log.parser.service.SeriesAssembler;

/**
 * Discovery state of one thread pool layout attempt: pools in discovery order,
 * their metric values per report timestamp, and which metrics were actually reported.
 * A pool reported twice for the same timestamp keeps the later values.
 */
public class ThreadPoolAccumulator {

    private final Set<Instant> timestamps = new LinkedHashSet<>();
    private final Map<String, Map<PoolMetric, TreeMap<Instant, Double>>> pools = new LinkedHashMap<>();
    private final Map<String, Set<PoolMetric>> observedMetrics = new LinkedHashMap<>();
    private final Set<PoolMetric> optionalMetricsSeen = EnumSet.noneOf(PoolMetric.class);
    private long rowCount;

    public void accumulate(Instant timestamp, String poolName, Map<PoolMetric, Long> metrics) {
        if (timestamp == null || poolName == null || poolName.isEmpty()) {
            return;
        }
        timestamps.add(timestamp);
        Map<PoolMetric, TreeMap<Instant, Double>> poolSeries = registerPool(poolName);
        Set<PoolMetric> observed = observedMetrics.get(poolName);

        for (Map.Entry<PoolMetric, Long> entry : metrics.entrySet()) {
            PoolMetric metric = entry.getKey();
            long value = entry.getValue() == null ? 0L : entry.getValue();
            poolSeries.computeIfAbsent(metric, k -> new TreeMap<>()).put(timestamp, (double) value);
            observed.add(metric);
            if (!metric.isStandard()) {
                optionalMetricsSeen.add(metric);
            }
        }
        rowCount++;
    }

    /**
     * Registers a pool without values, used when only its name could be recovered.
     */
    public Map<PoolMetric, TreeMap<Instant, Double>> registerPool(String poolName) {
        observedMetrics.computeIfAbsent(poolName, k -> EnumSet.noneOf(PoolMetric.class));
        return pools.computeIfAbsent(poolName, k -> new EnumMap<>(PoolMetric.class));
    }

    public void addTimestamp(Instant timestamp) {
        if (timestamp != null) {
            timestamps.add(timestamp);
        }
    }

    public int getPoolCount() {
        return pools.size();
    }

    public long getRowCount() {
        return rowCount;
    }

    public List<String> getPoolNames() {
        return new ArrayList<>(pools.keySet());
    }

    /**
     * Normalizes and assembles the result. Every pool gets a series for each standard metric and for
     * each optional metric some pool reported, so pools that never reported a column read 0 for it.
     */
    public ParsedTimeSeries toTimeSeries(Map<String, Object> extraMetadata) {
        if (pools.isEmpty()) {
            return ParsedTimeSeries.empty();
        }
        Set<PoolMetric> metricSet = PoolMetric.standardMetrics();
        metricSet.addAll(optionalMetricsSeen);

        Map<String, TreeMap<Instant, Double>> partial = new LinkedHashMap<>();
        for (Map.Entry<String, Map<PoolMetric, TreeMap<Instant, Double>>> pool : pools.entrySet()) {
            for (PoolMetric metric : metricSet) {
                TreeMap<Instant, Double> values = pool.getValue().get(metric);
                partial.put(metric.seriesKey(pool.getKey()), values == null ? new TreeMap<>() : values);
            }
        }

        Map<String, List<String>> poolMetrics = new LinkedHashMap<>();
        for (Map.Entry<String, Set<PoolMetric>> entry : observedMetrics.entrySet()) {
            List<String> labels = new ArrayList<>();
            for (PoolMetric metric : entry.getValue()) {
                labels.add(metric.getLabel());
            }
            poolMetrics.put(entry.getKey(), labels);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("threadPools", getPoolNames());
        metadata.put("poolMetrics", poolMetrics);
        if (extraMetadata != null) {
            metadata.putAll(extraMetadata);
        }
        return SeriesAssembler.assemble(timestamps, partial, metadata);
    }
}
