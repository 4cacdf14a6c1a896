package com.cassandra.log.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.extractor.GcEventExtractor;
import com.cassandra.log.parser.extractor.SeriesExtractor;
import com.cassandra.log.parser.extractor.SlowReadExtractor;
import com.cassandra.log.parser.extractor.StatusEventExtractor;
import com.cassandra.log.parser.extractor.ThreadPoolExtractor;
import com.cassandra.log.parser.extractor.TombstoneWarningExtractor;
import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Entry point of the extraction engine: splits a system.log once and runs every extractor over
 * the same immutable line list, one after the other or on a small worker pool.
 */
public class SystemLogParser {

    private static final Pattern LINE_SEPARATOR = Pattern.compile("\\r?\\n");

    private final ParserConfig config;
    private final Logger logger;
    private final GcEventExtractor gcExtractor;
    private final ThreadPoolExtractor threadPoolExtractor;
    private final TombstoneWarningExtractor tombstoneExtractor;
    private final SlowReadExtractor slowReadExtractor;
    private final StatusEventExtractor statusEventExtractor;

    public SystemLogParser() {
        this(new ParserConfig());
    }

    public SystemLogParser(ParserConfig config) {
        this(config, LoggerFactory.getLogger(SystemLogParser.class));
    }

    /**
     * @param logger receives the diagnostics of the parser and of every extractor
     */
    public SystemLogParser(ParserConfig config, Logger logger) {
        this.config = config;
        this.logger = logger;
        this.gcExtractor = new GcEventExtractor(config, logger);
        this.threadPoolExtractor = new ThreadPoolExtractor(config, logger);
        this.tombstoneExtractor = new TombstoneWarningExtractor(config, logger);
        this.slowReadExtractor = new SlowReadExtractor(config, logger);
        this.statusEventExtractor = new StatusEventExtractor(config, logger);
    }

    public SystemLogResult parse(String content) {
        if (content == null || content.trim().isEmpty()) {
            return SystemLogResult.empty();
        }
        return parseLines(splitLines(content));
    }

    public SystemLogResult parseLines(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return SystemLogResult.empty();
        }
        List<String> input = Collections.unmodifiableList(lines);
        long start = System.currentTimeMillis();

        Map<String, ParsedTimeSeries> results = config.isParallel() ? extractParallel(input) : extractSequential(input);

        SystemLogResult result = new SystemLogResult(
                results.get(gcExtractor.getName()),
                results.get(threadPoolExtractor.getName()),
                results.get(tombstoneExtractor.getName()),
                results.get(slowReadExtractor.getName()),
                results.get(statusEventExtractor.getName()),
                input.size());
        logger.debug("Parsed {} lines in {} ms: {}", input.size(), System.currentTimeMillis() - start,
                result.getDataQuality());
        return result;
    }

    public static List<String> splitLines(String content) {
        return Collections.unmodifiableList(Arrays.asList(LINE_SEPARATOR.split(content, -1)));
    }

    private List<SeriesExtractor> extractors() {
        return Arrays.asList(gcExtractor, threadPoolExtractor, tombstoneExtractor, slowReadExtractor,
                statusEventExtractor);
    }

    private Map<String, ParsedTimeSeries> extractSequential(List<String> lines) {
        Map<String, ParsedTimeSeries> results = new HashMap<>();
        for (SeriesExtractor extractor : extractors()) {
            results.put(extractor.getName(), run(extractor, lines));
        }
        return results;
    }

    private Map<String, ParsedTimeSeries> extractParallel(List<String> lines) {
        List<SeriesExtractor> extractors = extractors();
        int threads = Math.max(1, Math.min(extractors.size(), Runtime.getRuntime().availableProcessors()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CompletionService<Map.Entry<String, ParsedTimeSeries>> completionService =
                new ExecutorCompletionService<>(executor);
        try {
            for (SeriesExtractor extractor : extractors) {
                completionService.submit(() -> Map.entry(extractor.getName(), run(extractor, lines)));
            }
            Map<String, ParsedTimeSeries> results = new HashMap<>();
            for (int i = 0; i < extractors.size(); i++) {
                Map.Entry<String, ParsedTimeSeries> entry = completionService.take().get();
                results.put(entry.getKey(), entry.getValue());
            }
            return results;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LogParseException) {
                throw (LogParseException) cause;
            }
            throw new LogParseException("Extraction failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LogParseException("Interrupted while waiting for extractors", e);
        } finally {
            shutdown(executor);
        }
    }

    private ParsedTimeSeries run(SeriesExtractor extractor, List<String> lines) {
        try {
            return extractor.extract(lines);
        } catch (RuntimeException e) {
            throw new LogParseException("Extractor " + extractor.getName() + " failed", e);
        }
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warn("Executor did not terminate gracefully");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Executor interrupted");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public ParserConfig getConfig() {
        return config;
    }
}
