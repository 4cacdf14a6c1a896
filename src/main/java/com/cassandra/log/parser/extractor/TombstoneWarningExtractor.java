package com.cassandra.log.parser.extractor;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.LineCategory;
import com.cassandra.log.parser.accumulator.TombstoneAccumulator;
import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Extracts reads that scanned many tombstones.
 * <pre>
 * WARN  [ReadStage-2] 2023-06-15 10:15:23,456 ReadCommand.java:569 - Read 0 live rows and 50 tombstone cells for query SELECT * FROM ks.events WHERE id = 1 LIMIT 100
 * WARN  [ReadStage:12] 2016-01-01 10:00:00,000 SliceQueryFilter.java:308 - Read 10 live and 1500 tombstone cells in ks.events for key: 42
 * </pre>
 */
public class TombstoneWarningExtractor extends AbstractSeriesExtractor {

    private static final Pattern READ_COMMAND_PATTERN = Pattern.compile(
            "WARN.*ReadCommand\\.java:.*Read\\s+(\\d+)\\s+live\\s+rows\\s+and\\s+(\\d+)\\s+tombstone\\s+cells\\s+for\\s+query\\s+(.*)");

    private static final Pattern SLICE_QUERY_PATTERN = Pattern.compile(
            "SliceQueryFilter\\.java:\\d+\\s+-\\s+(Read\\s+(\\d+)\\s+live\\s+(?:rows\\s+)?and\\s+(\\d+)\\s+tombstone(?:d)?\\s+cells\\s+in\\s+(\\S+).*)");

    private static final Pattern FROM_PATTERN = Pattern.compile("\\sFROM\\s+([^\\s(,;]+)", Pattern.CASE_INSENSITIVE);

    public TombstoneWarningExtractor(ParserConfig config) {
        this(config, LoggerFactory.getLogger(TombstoneWarningExtractor.class));
    }

    public TombstoneWarningExtractor(ParserConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public String getName() {
        return "tombstoneWarnings";
    }

    @Override
    public ParsedTimeSeries extract(List<String> lines) {
        TombstoneAccumulator accumulator = new TombstoneAccumulator();

        forEachLine(lines, LineCategory.TOMBSTONE_WARNING, line -> {
            Optional<Instant> timestamp = timestamps.extract(line);
            if (!timestamp.isPresent()) {
                return;
            }
            Matcher m = READ_COMMAND_PATTERN.matcher(line);
            if (m.find()) {
                String query = m.group(3).trim();
                accumulator.accumulate(timestamp.get(), Long.parseLong(m.group(1)), Long.parseLong(m.group(2)),
                        truncate(query), tableFromQuery(query));
                return;
            }
            Matcher slice = SLICE_QUERY_PATTERN.matcher(line);
            if (slice.find()) {
                accumulator.accumulate(timestamp.get(), Long.parseLong(slice.group(2)), Long.parseLong(slice.group(3)),
                        truncate(slice.group(1).trim()), tableName(slice.group(4)));
            }
        });

        logger.debug("Tombstone warnings: {}", accumulator.getWarningCount());
        return accumulator.toTimeSeries(config.getTopQueries());
    }

    /**
     * Table named in the FROM clause, without keyspace or quotes. Null when there is no FROM clause.
     */
    static String tableFromQuery(String query) {
        Matcher m = FROM_PATTERN.matcher(query);
        if (!m.find()) {
            return null;
        }
        return tableName(m.group(1));
    }

    static String tableName(String qualified) {
        String name = qualified;
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            name = name.substring(dot + 1);
        }
        name = name.replace("\"", "").replace("'", "").replace("`", "");
        return name.isEmpty() || name.toLowerCase(Locale.ROOT).equals("null") ? null : name;
    }

    private String truncate(String query) {
        int max = config.getQueryPreviewLength();
        if (query.length() <= max) {
            return query;
        }
        return query.substring(0, max) + "...";
    }
}
