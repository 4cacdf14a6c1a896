package com.cassandra.log.parser.extractor.threadpool;

import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.LineCategory;
import com.cassandra.log.parser.LineClassifier;
import com.cassandra.log.parser.LogTimestamps;
import com.cassandra.log.parser.TimestampTracker;
import com.cassandra.log.parser.accumulator.ThreadPoolAccumulator;

/**
 * Base class for layouts that walk the document line by line with a fresh visitor per attempt.
 */
public abstract class AbstractThreadPoolLayout implements ThreadPoolLayout {

    private static final int MAX_LOGGED_ERRORS = 3;

    /** Lines after a report opener in which the column header must appear. */
    protected static final int HEADER_SEARCH_WINDOW = 3;

    protected final ParserConfig config;
    protected final LineClassifier classifier;
    protected final LogTimestamps timestamps;
    protected final PoolRowParser rowParser;
    protected final Logger logger;

    protected AbstractThreadPoolLayout(ParserConfig config, Logger logger) {
        this.config = config;
        this.classifier = new LineClassifier(config);
        this.timestamps = new LogTimestamps(config.getZone());
        this.rowParser = new PoolRowParser(config);
        this.logger = logger;
    }

    protected interface LineVisitor {

        void visit(String line);

        default void finish() {
        }
    }

    protected abstract LineVisitor newVisitor(ThreadPoolAccumulator accumulator);

    @Override
    public LayoutAttempt attempt(List<String> lines) {
        ThreadPoolAccumulator accumulator = new ThreadPoolAccumulator();
        LineVisitor visitor = newVisitor(accumulator);
        long errors = 0;
        for (String line : lines) {
            if (config.shouldIgnore(line)) {
                continue;
            }
            try {
                visitor.visit(line);
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
        visitor.finish();
        logger.debug("{}: {} pools, {} rows", getName(), accumulator.getPoolCount(), accumulator.getRowCount());
        return new LayoutAttempt(getName(), accumulator, isDegraded(), errors);
    }

    protected static boolean isStatusLogger(String line) {
        return line.contains(LineClassifier.STATUS_LOGGER);
    }

    /**
     * Text after the {@code " - "} separating the log prefix from the message, or the whole line.
     */
    protected static String contentAfterDash(String line) {
        int idx = line.indexOf(" - ");
        return idx < 0 ? line.trim() : line.substring(idx + 3).trim();
    }

    /**
     * True when a trimmed line inside a table closes it: a too-short line, a new log entry,
     * or the start of a non thread pool section.
     */
    protected boolean isBlockEnd(String trimmed) {
        return trimmed.length() < config.getMinRowLength()
                || PoolRowParser.isLogEntry(trimmed)
                || isSectionMarker(trimmed);
    }

    /**
     * True when the text opens a non thread pool section (memtables, caches, tables).
     */
    protected boolean isSectionMarker(String text) {
        return classifier.is(text, LineCategory.SECTION_MARKER);
    }

    /**
     * Tracks multi-line StatusLogger reports: a StatusLogger line opens a report, the column
     * header follows within {@link #HEADER_SEARCH_WINDOW} lines (or on the opener itself), and
     * every following line belongs to the table until {@link #isBlockEnd(String)}.
     */
    protected abstract class ReportBlockVisitor implements LineVisitor {

        private final TimestampTracker tracker = new TimestampTracker(timestamps);
        private boolean awaitingHeader;
        private boolean inBlock;
        private int linesWaited;
        private Instant reportTimestamp;
        private PoolHeader header;

        @Override
        public void visit(String line) {
            if (isStatusLogger(line)) {
                if (inBlock) {
                    onBlockEnd();
                }
                reportTimestamp = tracker.resolve(line).orElse(null);
                String content = contentAfterDash(line);
                header = null;
                inBlock = false;
                awaitingHeader = true;
                linesWaited = 0;
                if (PoolHeader.isHeader(content)) {
                    startBlock(content);
                }
                return;
            }
            tracker.update(line);
            String trimmed = line.trim();

            if (awaitingHeader) {
                if (PoolHeader.isHeader(trimmed)) {
                    startBlock(trimmed);
                } else if (++linesWaited >= HEADER_SEARCH_WINDOW || PoolRowParser.isLogEntry(trimmed)) {
                    awaitingHeader = false;
                }
                return;
            }
            if (!inBlock) {
                return;
            }
            if (PoolHeader.isHeader(trimmed)) {
                header = PoolHeader.parse(trimmed);
                return;
            }
            if (isBlockEnd(trimmed)) {
                inBlock = false;
                onBlockEnd();
                return;
            }
            onBlockLine(trimmed, header, reportTimestamp);
        }

        @Override
        public void finish() {
            if (inBlock) {
                inBlock = false;
                onBlockEnd();
            }
        }

        private void startBlock(String headerText) {
            header = PoolHeader.parse(headerText);
            awaitingHeader = false;
            inBlock = true;
        }

        /** Called for each line inside a table, already trimmed. */
        protected abstract void onBlockLine(String trimmed, PoolHeader header, Instant reportTimestamp);

        protected void onBlockEnd() {
        }
    }
}
