package com.cassandra.log.parser.accumulator;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.cassandra.log.parser.model.GcGeneration;
import com.cassandra.log.parser.model.ParsedTimeSeries;

public class GcEventAccumulatorTest {

    @Test
    public void testStatisticsCoverEveryEvent() {
        GcEventAccumulator accumulator = new GcEventAccumulator();
        Instant start = Instant.parse("2023-06-15T00:00:00Z");
        int events = 150000;
        for (int i = 0; i < events - 1; i++) {
            accumulator.accumulate(start.plusMillis(i), 10, GcGeneration.YOUNG, "PRIMARY", "G1 Young Generation GC");
        }
        accumulator.accumulate(start.plusMillis(events - 1), 5000, GcGeneration.OLD, "PRIMARY", "G1 Old Generation GC");

        ParsedTimeSeries result = accumulator.toTimeSeries();
        Map<?, ?> stats = (Map<?, ?>) result.getMetadata("gcStats");
        assertEquals((long) events, stats.get("count"));
        assertEquals(5000.0, (Double) stats.get("maxMs"), 0.0);
        assertEquals(10.0, (Double) stats.get("minMs"), 0.0);
        assertEquals(events, result.size());
    }
}
