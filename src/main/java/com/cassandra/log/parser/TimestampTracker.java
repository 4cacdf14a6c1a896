package com.cassandra.log.parser;

import java.time.Instant;
import java.util.Optional;

/**
 * Remembers the most recently seen timestamp so that lines without one
 * (report bodies, continuation lines) can be attributed to it.
 */
public class TimestampTracker {

    private final LogTimestamps timestamps;
    private Instant current;

    public TimestampTracker(LogTimestamps timestamps) {
        this.timestamps = timestamps;
    }

    /**
     * Reads the timestamp on the line, if any, and makes it the current context.
     */
    public Optional<Instant> update(String line) {
        Optional<Instant> parsed = timestamps.extract(line);
        parsed.ifPresent(ts -> current = ts);
        return parsed;
    }

    /**
     * Timestamp on the line, or the last seen one when the line has none.
     */
    public Optional<Instant> resolve(String line) {
        Optional<Instant> parsed = update(line);
        return parsed.isPresent() ? parsed : Optional.ofNullable(current);
    }

    public Optional<Instant> current() {
        return Optional.ofNullable(current);
    }
}
