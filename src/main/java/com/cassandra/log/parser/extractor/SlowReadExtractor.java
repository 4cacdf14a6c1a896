package com.cassandra.log.parser.extractor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.LineCategory;
import com.cassandra.log.parser.accumulator.SlowReadAccumulator;
import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Extracts timed out asynchronous SSTable reads.
 * <pre>
 * WARN  [CoreThread-3] 2025-02-27T13:24:23+0100 AsyncPartitionReader.java:121 - Timed out async read from sstable ... for file /var/lib/cassandra/data/ks/table-1234/aa-1-bti-Data.db
 * </pre>
 */
public class SlowReadExtractor extends AbstractSeriesExtractor {

    private static final Pattern SLOW_READ_PATTERN = Pattern.compile("WARN.*Timed out async read from.*for file\\s+(/\\S+)");

    public SlowReadExtractor(ParserConfig config) {
        this(config, LoggerFactory.getLogger(SlowReadExtractor.class));
    }

    public SlowReadExtractor(ParserConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public String getName() {
        return "slowReads";
    }

    @Override
    public ParsedTimeSeries extract(List<String> lines) {
        SlowReadAccumulator accumulator = new SlowReadAccumulator();

        forEachLine(lines, LineCategory.SLOW_READ, line -> {
            Matcher m = SLOW_READ_PATTERN.matcher(line);
            if (!m.find()) {
                return;
            }
            Optional<Instant> timestamp = timestamps.extract(line);
            timestamp.ifPresent(ts -> accumulator.accumulate(ts, m.group(1)));
        });

        logger.debug("Timed out reads: {}", accumulator.getTotal());
        return accumulator.toTimeSeries(config.getTopFiles());
    }
}
