package com.cassandra.log.parser.extractor;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.LineCategory;
import com.cassandra.log.parser.accumulator.StatusEventAccumulator;
import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Counts StatusLogger lines per instant, with the reporting thread taken from the bracketed tag.
 */
public class StatusEventExtractor extends AbstractSeriesExtractor {

    private static final Pattern THREAD_PATTERN = Pattern.compile("\\[([^\\]]+)\\]");

    public StatusEventExtractor(ParserConfig config) {
        this(config, LoggerFactory.getLogger(StatusEventExtractor.class));
    }

    public StatusEventExtractor(ParserConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public String getName() {
        return "statusEvents";
    }

    @Override
    public ParsedTimeSeries extract(List<String> lines) {
        StatusEventAccumulator accumulator = new StatusEventAccumulator();

        forEachLine(lines, LineCategory.STATUS_LOGGER, line -> timestamps.extract(line).ifPresent(ts -> {
            Matcher m = THREAD_PATTERN.matcher(line);
            accumulator.accumulate(ts, m.find() ? m.group(1) : null);
        }));

        return accumulator.toTimeSeries();
    }
}
