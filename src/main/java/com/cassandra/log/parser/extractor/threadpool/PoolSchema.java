package com.cassandra.log.parser.extractor.threadpool;

import static com.cassandra.log.parser.model.PoolMetric.ACTIVE;
import static com.cassandra.log.parser.model.PoolMetric.ALL_TIME_BLOCKED;
import static com.cassandra.log.parser.model.PoolMetric.BACKPRESSURE;
import static com.cassandra.log.parser.model.PoolMetric.BLOCKED;
import static com.cassandra.log.parser.model.PoolMetric.COMPLETED;
import static com.cassandra.log.parser.model.PoolMetric.DELAYED;
import static com.cassandra.log.parser.model.PoolMetric.PENDING;
import static com.cassandra.log.parser.model.PoolMetric.SHARED;
import static com.cassandra.log.parser.model.PoolMetric.STOLEN;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.cassandra.log.parser.model.PoolMetric;

/**
 * Fixed column orders used when a row cannot be mapped through a column header.
 */
public enum PoolSchema {

    SHORT(ACTIVE, PENDING, COMPLETED, BLOCKED, ALL_TIME_BLOCKED),
    DELAYED_COLUMN(ACTIVE, PENDING, DELAYED, COMPLETED, BLOCKED, ALL_TIME_BLOCKED),
    FULL(ACTIVE, PENDING, BACKPRESSURE, DELAYED, SHARED, STOLEN, COMPLETED, BLOCKED, ALL_TIME_BLOCKED);

    private final List<PoolMetric> columns;

    PoolSchema(PoolMetric... columns) {
        this.columns = Collections.unmodifiableList(Arrays.asList(columns));
    }

    public List<PoolMetric> getColumns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    /**
     * Picks the widest schema the row can fill. Rows shorter than {@link #SHORT} use its leading columns.
     */
    public static PoolSchema forValueCount(int count) {
        if (count >= FULL.size()) {
            return FULL;
        }
        if (count >= DELAYED_COLUMN.size()) {
            return DELAYED_COLUMN;
        }
        return SHORT;
    }
}
