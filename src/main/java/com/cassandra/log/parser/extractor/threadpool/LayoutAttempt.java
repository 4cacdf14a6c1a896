package com.cassandra.log.parser.extractor.threadpool;

import com.cassandra.log.parser.accumulator.ThreadPoolAccumulator;

/**
 * Outcome of running one layout over a whole document.
 */
public class LayoutAttempt {

    private final String layoutName;
    private final ThreadPoolAccumulator accumulator;
    private final boolean degraded;
    private final long lineErrors;

    public LayoutAttempt(String layoutName, ThreadPoolAccumulator accumulator, boolean degraded, long lineErrors) {
        this.layoutName = layoutName;
        this.accumulator = accumulator;
        this.degraded = degraded;
        this.lineErrors = lineErrors;
    }

    public String getLayoutName() {
        return layoutName;
    }

    public ThreadPoolAccumulator getAccumulator() {
        return accumulator;
    }

    public int getPoolCount() {
        return accumulator.getPoolCount();
    }

    public boolean isSuccessful() {
        return getPoolCount() > 0;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public long getLineErrors() {
        return lineErrors;
    }

    @Override
    public String toString() {
        return layoutName + ": " + getPoolCount() + " pools";
    }
}
