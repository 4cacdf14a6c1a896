package com.cassandra.log.parser.extractor;

import java.util.List;

import org.slf4j.Logger;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.LineCategory;
import com.cassandra.log.parser.LineClassifier;
import com.cassandra.log.parser.LogTimestamps;

/**
 * Shared plumbing for extractors: configuration, classification, timestamp parsing
 * and line level error isolation.
 */
public abstract class AbstractSeriesExtractor implements SeriesExtractor {

    private static final int MAX_LOGGED_ERRORS = 3;

    protected final ParserConfig config;
    protected final LineClassifier classifier;
    protected final LogTimestamps timestamps;
    protected final Logger logger;

    protected AbstractSeriesExtractor(ParserConfig config, Logger logger) {
        this.config = config;
        this.classifier = new LineClassifier(config);
        this.timestamps = new LogTimestamps(config.getZone());
        this.logger = logger;
    }

    @FunctionalInterface
    protected interface LineHandler {
        void handle(String line);
    }

    /**
     * Feeds every line of the given category to the handler. A failure on one line is
     * logged and skipped. Passing a null category feeds every line.
     *
     * @return number of lines that failed
     */
    protected long forEachLine(List<String> lines, LineCategory category, LineHandler handler) {
        long errors = 0;
        for (String line : lines) {
            if (category != null && classifier.classify(line) != category) {
                continue;
            }
            try {
                handler.handle(line);
            } catch (RuntimeException e) {
                errors++;
                if (errors <= MAX_LOGGED_ERRORS) {
                    logger.warn("{}: skipping line after error {}: {}", getName(), e.toString(),
                            line.substring(0, Math.min(200, line.length())));
                } else {
                    logger.debug("{}: skipping line after error", getName(), e);
                }
            }
        }
        if (errors > 0) {
            logger.warn("{}: {} line(s) could not be parsed", getName(), errors);
        }
        return errors;
    }

    protected static String preview(String line) {
        if (line.length() <= 50) {
            return line;
        }
        return line.substring(0, 50) + "...";
    }
}
