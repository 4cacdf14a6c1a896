package com.cassandra.log.parser.extractor.threadpool;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.TimestampTracker;
import com.cassandra.log.parser.accumulator.ThreadPoolAccumulator;

/**
 * Legacy Cassandra 2.x/3.x report where every row is its own log entry:
 * <pre>
 * INFO  [ScheduledTasks:1] 2019-03-04 10:00:00,123 StatusLogger.java:51 - Pool Name                    Active   Pending      Completed   Blocked  All Time Blocked
 * INFO  [ScheduledTasks:1] 2019-03-04 10:00:00,125 StatusLogger.java:56 - CompactionExecutor                2       170          99022         0                 0
 * </pre>
 * Rows following a header are attributed to the header's timestamp so one report lands on one instant;
 * rows seen before any header use their own. Rows are mapped through the header when the column count
 * matches, otherwise by the positional schema for their value count. The sections that follow the pool
 * table (column family, cache, messaging) suspend row parsing until the next header.
 */
public class SingleLineLayout extends AbstractThreadPoolLayout {

    private static final Pattern CONTENT_PATTERN = Pattern.compile("StatusLogger\\.java:\\d+\\s+-\\s+(.*)$");

    public SingleLineLayout(ParserConfig config) {
        this(config, LoggerFactory.getLogger(SingleLineLayout.class));
    }

    public SingleLineLayout(ParserConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public String getName() {
        return "singleLine";
    }

    @Override
    protected LineVisitor newVisitor(ThreadPoolAccumulator accumulator) {
        TimestampTracker tracker = new TimestampTracker(timestamps);
        return new LineVisitor() {

            private PoolHeader header;
            private Instant headerTimestamp;
            private boolean suspended;

            @Override
            public void visit(String line) {
                if (!isStatusLogger(line)) {
                    tracker.update(line);
                    return;
                }
                Matcher m = CONTENT_PATTERN.matcher(line);
                Optional<Instant> timestamp = tracker.resolve(line);
                if (!m.find()) {
                    return;
                }
                String content = m.group(1).trim();
                if (content.isEmpty()) {
                    return;
                }
                if (PoolHeader.isHeader(content)) {
                    header = PoolHeader.parse(content);
                    headerTimestamp = timestamp.orElse(null);
                    suspended = false;
                    return;
                }
                if (isSectionMarker(content)) {
                    suspended = true;
                    return;
                }
                if (suspended) {
                    return;
                }
                Instant rowTimestamp = headerTimestamp != null ? headerTimestamp : timestamp.orElse(null);
                rowParser.parse(content, header).ifPresent(
                        row -> accumulator.accumulate(rowTimestamp, row.getPoolName(), row.getMetrics()));
            }
        };
    }
}
