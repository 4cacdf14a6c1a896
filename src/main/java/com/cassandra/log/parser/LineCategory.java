package com.cassandra.log.parser;

/**
 * Event family a raw system.log line may belong to.
 */
public enum LineCategory {
    GC_EVENT,
    STATUS_LOGGER,
    TOMBSTONE_WARNING,
    SLOW_READ,
    SECTION_MARKER,
    NONE
}
