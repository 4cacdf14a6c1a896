package com.cassandra.log.parser.extractor;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.accumulator.SlowReadAccumulator;
import com.cassandra.log.parser.model.ParsedTimeSeries;

public class SlowReadExtractorTest {

    private static final String LINE =
            "WARN  [CoreThread-3] 2025-02-27T13:24:23+0100 AsyncPartitionReader.java:121 - Timed out async read from sstable for file /var/lib/cassandra/data/ks/table-1234/aa-%d-bti-Data.db";

    private final SlowReadExtractor extractor = new SlowReadExtractor(new ParserConfig());

    @Test
    public void testTimedOutRead() {
        ParsedTimeSeries result = extractor.extract(List.of(String.format(LINE, 1)));

        assertEquals(List.of(Instant.parse("2025-02-27T12:24:23Z")), result.getTimestamps());
        assertEquals(List.of(1.0), result.getSeries(SlowReadAccumulator.TIMED_OUT_SERIES));
        assertEquals(List.of(1.0), result.getSeries("File: table-1234/aa-1-bti-Data.db"));
        assertEquals(1L, result.getMetadata("totalTimeouts"));
    }

    @Test
    public void testFileKey() {
        assertEquals("table-1234/aa-1-bti-Data.db",
                SlowReadAccumulator.fileKey("/var/lib/cassandra/data/ks/table-1234/aa-1-bti-Data.db"));
        assertEquals("Data.db", SlowReadAccumulator.fileKey("/Data.db"));
        assertEquals("unknown", SlowReadAccumulator.fileKey(""));
    }

    @Test
    public void testTopFilesLimited() {
        List<String> lines = new ArrayList<>();
        // file n times out n times, all within the same second
        for (int file = 1; file <= 7; file++) {
            for (int i = 0; i < file; i++) {
                lines.add(String.format(LINE, file));
            }
        }
        ParsedTimeSeries result = extractor.extract(lines);

        assertEquals(1, result.size());
        assertEquals(List.of(28.0), result.getSeries(SlowReadAccumulator.TIMED_OUT_SERIES));

        List<String> fileSeries = new ArrayList<>();
        for (String name : result.getSeries().keySet()) {
            if (name.startsWith(SlowReadAccumulator.FILE_SERIES_PREFIX)) {
                fileSeries.add(name);
            }
        }
        assertEquals(ParserConfig.DEFAULT_TOP_FILES, fileSeries.size());
        assertEquals("File: table-1234/aa-7-bti-Data.db", fileSeries.get(0));
        assertFalse(fileSeries.contains("File: table-1234/aa-1-bti-Data.db"));

        // counts keep every file
        Map<?, ?> counts = (Map<?, ?>) result.getMetadata("fileCounts");
        assertEquals(7, counts.size());
        assertEquals(1L, counts.get("table-1234/aa-1-bti-Data.db"));
    }

    @Test
    public void testSeriesAlignedAcrossInstants() {
        ParsedTimeSeries result = extractor.extract(Arrays.asList(
                String.format(LINE, 1),
                String.format(LINE, 2).replace("13:24:23", "13:25:00"),
                "INFO  [main] 2025-02-27T13:24:23+0100 Foo.java:1 - Timed out async read without a file"));

        assertEquals(2, result.size());
        assertEquals(Arrays.asList(1.0, 0.0), result.getSeries("File: table-1234/aa-1-bti-Data.db"));
        assertEquals(Arrays.asList(0.0, 1.0), result.getSeries("File: table-1234/aa-2-bti-Data.db"));
    }

    @Test
    public void testNoTimeouts() {
        assertTrue(extractor.extract(List.of("INFO  [main] 2025-02-27T13:24:23+0100 Foo.java:1 - started")).isEmpty());
    }
}
