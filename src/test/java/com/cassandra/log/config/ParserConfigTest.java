package com.cassandra.log.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Properties;

import org.junit.jupiter.api.Test;

public class ParserConfigTest {

    @Test
    public void testDefaults() {
        ParserConfig config = new ParserConfig();

        assertEquals(ZoneOffset.UTC, config.getZone());
        assertEquals(100, config.getEstimatedGcDurationMs());
        assertEquals(20, config.getTopQueries());
        assertEquals(100, config.getQueryPreviewLength());
        assertEquals(5, config.getTopFiles());
        assertEquals(3, config.getMinRowLength());
        assertFalse(config.isParallel());
        assertTrue(config.getIgnorePatterns().isEmpty());
        assertTrue(config.getSectionMarkers().contains("Memtable Metrics"));
        assertTrue(config.getSkipKeywords().contains("capacity"));
    }

    @Test
    public void testLoadScalarSettings() {
        Properties props = new Properties();
        props.setProperty("parser.timezone", "Europe/Berlin");
        props.setProperty("parser.gc.estimatedDurationMs", "250");
        props.setProperty("parser.tombstone.topQueries", "5");
        props.setProperty("parser.tombstone.queryPreviewLength", "40");
        props.setProperty("parser.slowreads.topFiles", "3");
        props.setProperty("parser.threadpool.minRowLength", "4");
        props.setProperty("parser.parallel", "true");

        ParserConfig config = new ParserConfig();
        config.loadFromProperties(props);

        assertEquals(ZoneId.of("Europe/Berlin"), config.getZone());
        assertEquals(250, config.getEstimatedGcDurationMs());
        assertEquals(5, config.getTopQueries());
        assertEquals(40, config.getQueryPreviewLength());
        assertEquals(3, config.getTopFiles());
        assertEquals(4, config.getMinRowLength());
        assertTrue(config.isParallel());
    }

    @Test
    public void testInvalidValuesKeepDefaults() {
        Properties props = new Properties();
        props.setProperty("parser.timezone", "Not/AZone");
        props.setProperty("parser.gc.estimatedDurationMs", "abc");
        props.setProperty("parser.tombstone.topQueries", "-1");

        ParserConfig config = new ParserConfig();
        config.loadFromProperties(props);

        assertEquals(ZoneOffset.UTC, config.getZone());
        assertEquals(100, config.getEstimatedGcDurationMs());
        assertEquals(20, config.getTopQueries());
    }

    @Test
    public void testIgnorePatterns() {
        Properties props = new Properties();
        props.setProperty("filter.ignore.patterns", "CompactionTask.java, ColumnFamilyStore.java");
        props.setProperty("filter.ignore.add", "Gossiper.java");
        props.setProperty("filter.ignore.remove", "ColumnFamilyStore.java");

        ParserConfig config = new ParserConfig();
        config.loadFromProperties(props);

        assertEquals(2, config.getIgnorePatterns().size());
        assertTrue(config.shouldIgnore("INFO  [CompactionExecutor:1] 2023-06-15 10:15:23,456 CompactionTask.java:241 - Compacted"));
        assertTrue(config.shouldIgnore("INFO  [GossipStage:1] 2023-06-15 10:15:23,456 Gossiper.java:1011 - Node up"));
        assertFalse(config.shouldIgnore("INFO  [MemtableFlushWriter:1] 2023-06-15 10:15:23,456 ColumnFamilyStore.java:1 - Flush"));
    }

    @Test
    public void testSectionMarkers() {
        ParserConfig config = new ParserConfig();

        assertTrue(config.isSectionMarker("Memtable Metrics"));
        assertTrue(config.isSectionMarker("Table                               Active    Pending    Completed"));
        assertTrue(config.isSectionMarker("ColumnFamily                Memtable ops,data"));
        assertFalse(config.isSectionMarker("TableFlushWriter   0   0   12   0   0"));
        assertFalse(config.isSectionMarker("CompactionExecutor   2   170   99022   0   0"));
    }

    @Test
    public void testReplaceSectionMarkersAndSkipKeywords() {
        Properties props = new Properties();
        props.setProperty("parser.threadpool.sectionMarkers", "Custom Section");
        props.setProperty("parser.threadpool.skipKeywords", "bogus");

        ParserConfig config = new ParserConfig();
        config.loadFromProperties(props);

        assertTrue(config.isSectionMarker("Custom Section"));
        assertFalse(config.isSectionMarker("Memtable Metrics"));
        assertEquals(1, config.getSkipKeywords().size());
    }
}
