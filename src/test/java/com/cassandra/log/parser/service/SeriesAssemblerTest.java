package com.cassandra.log.parser.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import com.cassandra.log.parser.model.ParsedTimeSeries;

public class SeriesAssemblerTest {

    private static final Instant T1 = Instant.parse("2023-06-15T10:00:00Z");
    private static final Instant T2 = Instant.parse("2023-06-15T10:01:00Z");
    private static final Instant T3 = Instant.parse("2023-06-15T10:02:00Z");

    @Test
    public void testAxisSortedAndDistinct() {
        Map<String, TreeMap<Instant, Double>> partial = new LinkedHashMap<>();
        partial.put("a", new TreeMap<>(Map.of(T1, 1.0)));

        ParsedTimeSeries result = SeriesAssembler.assemble(Arrays.asList(T3, T1, T3, null), partial, Map.of());

        assertEquals(Arrays.asList(T1, T3), result.getTimestamps());
        assertEquals(Arrays.asList(1.0, 0.0), result.getSeries("a"));
    }

    @Test
    public void testGapsFilledWithDefault() {
        Map<String, TreeMap<Instant, Double>> partial = new LinkedHashMap<>();
        partial.put("sparse", new TreeMap<>(Map.of(T2, 5.0)));
        partial.put("invalid", new TreeMap<>(Map.of(T1, Double.NaN, T3, Double.POSITIVE_INFINITY)));
        partial.put("empty", new TreeMap<>());

        ParsedTimeSeries result = SeriesAssembler.assemble(List.of(T1, T2, T3), partial, null);

        assertEquals(Arrays.asList(0.0, 5.0, 0.0), result.getSeries("sparse"));
        assertEquals(Arrays.asList(0.0, 0.0, 0.0), result.getSeries("invalid"));
        assertEquals(Arrays.asList(0.0, 0.0, 0.0), result.getSeries("empty"));
        // insertion order of the partial series is kept
        assertEquals(Arrays.asList("sparse", "invalid", "empty"), List.copyOf(result.getSeries().keySet()));
        assertTrue(result.getMetadata().isEmpty());
    }

    @Test
    public void testAxisIncludesSeriesInstants() {
        Map<String, TreeMap<Instant, Double>> partial = new LinkedHashMap<>();
        partial.put("a", new TreeMap<>(Map.of(T2, 2.0)));

        ParsedTimeSeries result = SeriesAssembler.assemble(List.of(T1), partial, Map.of("k", "v"));

        assertEquals(Arrays.asList(T1, T2), result.getTimestamps());
        assertEquals(Arrays.asList(0.0, 2.0), result.getSeries("a"));
        assertEquals("v", result.getMetadata("k"));
    }

    @Test
    public void testMisalignedSeriesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ParsedTimeSeries(List.of(T1, T2), Map.of("a", List.of(1.0)), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new ParsedTimeSeries(List.of(T2, T1), Map.of(), Map.of()));
    }
}
