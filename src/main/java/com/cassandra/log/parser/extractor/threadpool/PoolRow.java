package com.cassandra.log.parser.extractor.threadpool;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.cassandra.log.parser.model.PoolMetric;

/**
 * One parsed pool line: the pool name and the metric values read from it.
 */
public class PoolRow {

    private final String poolName;
    private final Map<PoolMetric, Long> metrics;

    public PoolRow(String poolName, Map<PoolMetric, Long> metrics) {
        this.poolName = poolName;
        Map<PoolMetric, Long> copy = new EnumMap<>(PoolMetric.class);
        copy.putAll(metrics);
        this.metrics = Collections.unmodifiableMap(copy);
    }

    public String getPoolName() {
        return poolName;
    }

    public Map<PoolMetric, Long> getMetrics() {
        return metrics;
    }

    public Long get(PoolMetric metric) {
        return metrics.get(metric);
    }

    @Override
    public String toString() {
        return poolName + " " + metrics;
    }
}
