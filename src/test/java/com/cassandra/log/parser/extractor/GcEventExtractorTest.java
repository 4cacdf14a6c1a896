package com.cassandra.log.parser.extractor;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.SystemLogParser;
import com.cassandra.log.parser.accumulator.GcEventAccumulator;
import com.cassandra.log.parser.model.ParsedTimeSeries;

public class GcEventExtractorTest {

    private final GcEventExtractor extractor = new GcEventExtractor(new ParserConfig());

    @Test
    public void testRoundTripOfSyntheticLines() {
        List<String> lines = new ArrayList<>();
        List<Long> durations = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            long duration = 100 + i * 7;
            durations.add(duration);
            lines.add(String.format(
                    "INFO  [GCInspector:1] 2023-06-15 10:%02d:%02d,000 GCInspector.java:284 - G1 Young Generation GC in %dms",
                    i / 60, i % 60, duration));
            lines.add("INFO  [CompactionExecutor:1] 2023-06-15 10:00:00,000 CompactionTask.java:241 - Compacted");
        }

        ParsedTimeSeries result = extractor.extract(lines);

        assertEquals(50, result.size());
        List<Double> values = result.getSeries(GcEventAccumulator.DURATION_SERIES);
        for (int i = 0; i < 50; i++) {
            assertEquals(durations.get(i).doubleValue(), values.get(i));
        }
        Map<?, ?> ruleCounts = (Map<?, ?>) result.getMetadata("ruleCounts");
        assertEquals(50L, ruleCounts.get(GcRule.PRIMARY.name()));
        assertEquals(1, ruleCounts.size());
    }

    @Test
    public void testPrimaryRule() {
        ParsedTimeSeries result = extractor.extract(List.of(
                "INFO  [GCInspector:1] 2023-06-15 10:15:23,456 GCInspector.java:284 - G1 Young Generation GC in 250ms"));

        assertEquals(List.of(Instant.parse("2023-06-15T10:15:23.456Z")), result.getTimestamps());
        assertEquals(List.of(250.0), result.getSeries(GcEventAccumulator.DURATION_SERIES));
        assertEquals(List.of("young"), result.getMetadata("gcTypes"));
        assertEquals(List.of("G1 Young Generation GC"), result.getMetadata("rawDescriptions"));
    }

    @Test
    public void testGenerationRules() {
        ParsedTimeSeries result = extractor.extract(List.of(
                "INFO  [Service Thread] 2019-01-01 10:00:00,000 GCInspector.java:258 - ParNew GC in 312ms.  CMS Old Gen: 1000 -> 2000; Par Eden Space: 300 -> 0",
                "WARN  [Service Thread] 2019-01-01 10:00:05,000 GCInspector.java:282 - ConcurrentMarkSweep GC in 1283ms.  CMS Old Gen: 5000 -> 1000"));

        assertEquals(List.of(312.0, 1283.0), result.getSeries(GcEventAccumulator.DURATION_SERIES));
        assertEquals(List.of("young", "old"), result.getMetadata("gcTypes"));

        Map<?, ?> ruleCounts = (Map<?, ?>) result.getMetadata("ruleCounts");
        assertEquals(1L, ruleCounts.get(GcRule.YOUNG_GENERATION.name()));
        assertEquals(1L, ruleCounts.get(GcRule.OLD_GENERATION.name()));

        Map<?, ?> generationCounts = (Map<?, ?>) result.getMetadata("generationCounts");
        assertEquals(1L, generationCounts.get("young"));
        assertEquals(1L, generationCounts.get("old"));
        assertEquals(0L, generationCounts.get("unknown"));
    }

    @Test
    public void testFallbackRules() {
        ParsedTimeSeries result = extractor.extract(List.of(
                "INFO  [GCInspector:1] 2023-06-15 10:15:23 GCInspector.java:284 - G1 Mixed GC in 40ms",
                "INFO  [Service Thread] 2019-01-01T10:00:10.000Z GCInspector.java:258 - G1 Mixed pause 45 ms",
                "INFO  [main] 2019-01-01 10:00:20,000 CassandraDaemon.java:1 - context",
                "GCInspector reported a pause of 120ms"));

        assertEquals(3, result.size());
        Map<?, ?> ruleCounts = (Map<?, ?>) result.getMetadata("ruleCounts");
        assertEquals(1L, ruleCounts.get(GcRule.FALLBACK_BRACKETED.name()));
        assertEquals(1L, ruleCounts.get(GcRule.FALLBACK_SOURCE_TAG.name()));
        assertEquals(1L, ruleCounts.get(GcRule.FALLBACK_ANY_DURATION.name()));

        // the untimed line takes the last timestamp seen
        assertEquals(120.0, result.valueAt(GcEventAccumulator.DURATION_SERIES, Instant.parse("2019-01-01T10:00:20Z")));
        assertEquals(45.0, result.valueAt(GcEventAccumulator.DURATION_SERIES, Instant.parse("2019-01-01T10:00:10Z")));
        assertEquals(40.0, result.valueAt(GcEventAccumulator.DURATION_SERIES, Instant.parse("2023-06-15T10:15:23Z")));
    }

    @Test
    public void testEstimatedDuration() {
        ParserConfig config = new ParserConfig();
        config.setEstimatedGcDurationMs(75);
        ParsedTimeSeries result = new GcEventExtractor(config).extract(List.of(
                "INFO  [GCInspector:1] 2023-06-15 10:20:00,000 GCInspector.java:284 - Heap is full, pause ms unknown"));

        assertEquals(List.of(75.0), result.getSeries(GcEventAccumulator.DURATION_SERIES));
        Map<?, ?> ruleCounts = (Map<?, ?>) result.getMetadata("ruleCounts");
        assertEquals(1L, ruleCounts.get(GcRule.ESTIMATED.name()));
        assertTrue(((List<?>) result.getMetadata("rawDescriptions")).get(0).toString().startsWith("ESTIMATED: "));
    }

    @Test
    public void testOversizedDurationFallsBackToEstimate() {
        ParsedTimeSeries result = extractor.extract(List.of(
                "INFO  [GCInspector:1] 2023-06-15 10:20:00,000 GCInspector.java:284 - G1 Young Generation GC in 99999999999999999999ms"));

        assertEquals(List.of((double) ParserConfig.DEFAULT_ESTIMATED_GC_DURATION_MS),
                result.getSeries(GcEventAccumulator.DURATION_SERIES));
        Map<?, ?> ruleCounts = (Map<?, ?>) result.getMetadata("ruleCounts");
        assertEquals(1L, ruleCounts.get(GcRule.ESTIMATED.name()));
        assertEquals(List.of("young"), result.getMetadata("gcTypes"));
    }

    @Test
    public void testNoEventWithoutAnyTimestamp() {
        ParsedTimeSeries result = extractor.extract(List.of(
                "GCInspector reported a pause of 120ms",
                "GCInspector pause ms"));
        assertTrue(result.isEmpty());
        assertTrue(result.getSeries().isEmpty());
    }

    @Test
    public void testSameInstantIsSummed() {
        ParsedTimeSeries result = extractor.extract(List.of(
                "INFO  [GCInspector:1] 2023-06-15 10:15:23,456 GCInspector.java:284 - G1 Young Generation GC in 250ms",
                "INFO  [GCInspector:1] 2023-06-15 10:15:23,456 GCInspector.java:284 - G1 Old Generation GC in 1000ms"));

        assertEquals(1, result.size());
        assertEquals(List.of(1250.0), result.getSeries(GcEventAccumulator.DURATION_SERIES));
        assertEquals(List.of("young"), result.getMetadata("gcTypes"));
        Map<?, ?> stats = (Map<?, ?>) result.getMetadata("gcStats");
        assertEquals(2L, stats.get("count"));
        assertEquals(1250L, stats.get("totalMs"));
    }

    @Test
    public void testNoGcLines() {
        ParsedTimeSeries result = extractor.extract(SystemLogParser.splitLines("""
                INFO  [main] 2023-06-15 10:15:23,456 CassandraDaemon.java:501 - JVM vendor/version
                INFO  [main] 2023-06-15 10:15:24,456 StorageService.java:700 - Startup complete
                """));
        assertTrue(result.isEmpty());
        assertTrue(result.getMetadata().isEmpty());
    }
}
