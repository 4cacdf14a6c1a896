package com.cassandra.log.parser.extractor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.extractor.threadpool.LayoutAttempt;
import com.cassandra.log.parser.extractor.threadpool.QualifiedNameRecoveryLayout;
import com.cassandra.log.parser.extractor.threadpool.SingleLineLayout;
import com.cassandra.log.parser.extractor.threadpool.SplitRowLayout;
import com.cassandra.log.parser.extractor.threadpool.StatusLoggerTableLayout;
import com.cassandra.log.parser.extractor.threadpool.ThreadPoolLayout;
import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Extracts per pool metrics from StatusLogger reports.
 * <p>
 * The layouts are tried in order over the whole document and the first one that discovers at
 * least one pool is used; the remaining layouts are not run. Layouts share nothing but the
 * immutable line list, so each attempt starts from scratch.
 */
public class ThreadPoolExtractor extends AbstractSeriesExtractor {

    private final List<ThreadPoolLayout> layouts;

    public ThreadPoolExtractor(ParserConfig config) {
        this(config, LoggerFactory.getLogger(ThreadPoolExtractor.class));
    }

    public ThreadPoolExtractor(ParserConfig config, Logger logger) {
        this(config, logger, defaultLayouts(config, logger));
    }

    public ThreadPoolExtractor(ParserConfig config, Logger logger, List<ThreadPoolLayout> layouts) {
        super(config, logger);
        this.layouts = Collections.unmodifiableList(new ArrayList<>(layouts));
    }

    public static List<ThreadPoolLayout> defaultLayouts(ParserConfig config, Logger logger) {
        return Arrays.asList(
                new StatusLoggerTableLayout(config, logger),
                new SingleLineLayout(config, logger),
                new SplitRowLayout(config, logger),
                new QualifiedNameRecoveryLayout(config, logger));
    }

    @Override
    public String getName() {
        return "threadPoolMetrics";
    }

    @Override
    public ParsedTimeSeries extract(List<String> lines) {
        Map<String, Integer> attempts = new LinkedHashMap<>();
        for (ThreadPoolLayout layout : layouts) {
            LayoutAttempt attempt = layout.attempt(lines);
            attempts.put(attempt.getLayoutName(), attempt.getPoolCount());
            if (attempt.getLineErrors() > 0) {
                logger.warn("Layout {} skipped {} line(s) after errors", attempt.getLayoutName(), attempt.getLineErrors());
            }
            if (!attempt.isSuccessful()) {
                continue;
            }
            if (attempt.isDegraded()) {
                logger.warn("No thread pool table recognized, recovered {} pool names without values",
                        attempt.getPoolCount());
            } else {
                logger.debug("Thread pools read with layout {}: {} pools, {} rows", attempt.getLayoutName(),
                        attempt.getPoolCount(), attempt.getAccumulator().getRowCount());
            }
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("layout", attempt.getLayoutName());
            extra.put("layoutAttempts", attempts);
            extra.put("degraded", attempt.isDegraded());
            return attempt.getAccumulator().toTimeSeries(extra);
        }
        logger.debug("No thread pools found, layouts tried: {}", attempts);
        return ParsedTimeSeries.empty();
    }
}
