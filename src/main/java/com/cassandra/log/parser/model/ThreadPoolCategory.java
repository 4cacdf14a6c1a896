package com.cassandra.log.parser.model;

/**
 * Category of a thread pool, derived from its name only.
 */
public enum ThreadPoolCategory {

    STANDARD,
    PER_CORE;

    public static final String PER_CORE_PREFIX = "TPC/";

    public static ThreadPoolCategory of(String poolName) {
        if (poolName != null && poolName.startsWith(PER_CORE_PREFIX)) {
            return PER_CORE;
        }
        return STANDARD;
    }
}
