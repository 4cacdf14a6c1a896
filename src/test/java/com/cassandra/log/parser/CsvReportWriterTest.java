package com.cassandra.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CsvReportWriterTest {

    @TempDir
    File tempDir;

    @Test
    public void testWritesNonEmptyFamilies() throws Exception {
        SystemLogResult result = new SystemLogParser().parse("""
                INFO  [GCInspector:1] 2023-06-15 10:15:10,100 GCInspector.java:284 - G1 Young Generation GC in 250ms
                WARN  [Service Thread] 2023-06-15 10:15:20,200 GCInspector.java:282 - ConcurrentMarkSweep GC in 1200ms.
                """);
        File dir = new File(tempDir, "csv");

        List<File> written = CsvReportWriter.write(dir, "node1", result);

        assertEquals(1, written.size());
        assertEquals(new File(dir, "node1-gcEvents.csv"), written.get(0));
        List<String> lines = Files.readAllLines(written.get(0).toPath(), StandardCharsets.UTF_8);
        assertEquals("timestamp,GC Duration (ms)", lines.get(0));
        assertEquals("2023-06-15T10:15:10.100Z,250", lines.get(1));
        assertEquals("2023-06-15T10:15:20.200Z,1200", lines.get(2));
        assertEquals(3, lines.size());
    }

    @Test
    public void testSampleLogFamilies() throws Exception {
        SystemLogResult result = new SystemLogParser().parse(SampleLogs.systemLog());

        List<File> written = CsvReportWriter.write(tempDir, "system.log", result);

        List<String> names = new ArrayList<>();
        written.forEach(f -> names.add(f.getName()));
        assertEquals(List.of("system.log-gcEvents.csv", "system.log-threadPoolMetrics.csv",
                "system.log-tombstoneWarnings.csv", "system.log-slowReads.csv", "system.log-statusEvents.csv"), names);

        List<String> pools = Files.readAllLines(written.get(1).toPath(), StandardCharsets.UTF_8);
        assertTrue(pools.get(0).startsWith("timestamp,CompactionExecutor: Active,"));
        assertEquals(2, pools.size());
    }

    @Test
    public void testFormatting() {
        assertEquals("250", CsvReportWriter.format(250.0));
        assertEquals("0.8", CsvReportWriter.format(0.8));
        assertEquals("plain", CsvReportWriter.escape("plain"));
        assertEquals("\"a,b\"", CsvReportWriter.escape("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", CsvReportWriter.escape("say \"hi\""));
    }
}
