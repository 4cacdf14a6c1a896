package com.cassandra.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class LogTimestampsTest {

    private final LogTimestamps timestamps = new LogTimestamps();

    @Test
    public void testLocalTimestampWithCommaMillis() {
        Optional<Instant> ts = timestamps.extract(
                "INFO  [OptionalTasks:1] 2023-06-15 10:15:23,456 StatusLogger.java:174 - ");
        assertEquals(Instant.parse("2023-06-15T10:15:23.456Z"), ts.get());
    }

    @Test
    public void testLocalTimestampWithoutFraction() {
        assertEquals(Instant.parse("2023-06-15T10:15:23Z"), timestamps.parse("2023-06-15 10:15:23").get());
    }

    @Test
    public void testIsoOffsetWithoutColon() {
        Optional<Instant> ts = timestamps.extract(
                "WARN  [CoreThread-3] 2025-02-27T13:24:23+0100 AsyncPartitionReader.java:121 - Timed out");
        assertEquals(Instant.parse("2025-02-27T12:24:23Z"), ts.get());
    }

    @Test
    public void testIsoOffsetWithFractionAndZulu() {
        assertEquals(Instant.parse("2023-06-15T10:15:23.456Z"), timestamps.parse("2023-06-15T10:15:23.456Z").get());
        assertEquals(Instant.parse("2023-06-15T08:15:23.456Z"),
                timestamps.parse("2023-06-15T10:15:23,456+02:00").get());
    }

    @Test
    public void testConfiguredZoneForLocalTimestamps() {
        LogTimestamps berlin = new LogTimestamps(ZoneId.of("Europe/Berlin"));
        assertEquals(Instant.parse("2023-06-15T08:15:23.456Z"), berlin.parse("2023-06-15 10:15:23,456").get());
        // explicit offsets are not affected by the zone
        assertEquals(Instant.parse("2023-06-15T10:15:23Z"), berlin.parse("2023-06-15T10:15:23Z").get());
    }

    @Test
    public void testNoTimestamp() {
        assertFalse(timestamps.extract("CompactionExecutor   2   170   99022   0   0").isPresent());
        assertFalse(timestamps.extract("").isPresent());
        assertFalse(timestamps.extract(null).isPresent());
        assertFalse(timestamps.parse("2023-13-45 10:15:23,456").isPresent());
    }

    @Test
    public void testTrackerKeepsLastTimestamp() {
        TimestampTracker tracker = new TimestampTracker(timestamps);
        assertFalse(tracker.resolve("no timestamp yet").isPresent());

        tracker.update("INFO  [main] 2023-06-15 10:15:23,456 Foo.java:1 - hello");
        assertEquals(Instant.parse("2023-06-15T10:15:23.456Z"), tracker.resolve("continuation line").get());

        assertEquals(Instant.parse("2023-06-15T10:15:23.456Z"), tracker.current().get());
    }
}
