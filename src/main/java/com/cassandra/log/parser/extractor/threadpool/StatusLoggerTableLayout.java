package com.cassandra.log.parser.extractor.threadpool;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.accumulator.ThreadPoolAccumulator;

/**
 * Multi-line report used by DSE 6.x and Cassandra 4.x:
 * <pre>
 * INFO  [OptionalTasks:1] 2023-06-15 10:15:23,456 StatusLogger.java:174 -
 * Pool Name                    Active   Pending (w/Backpressure)   Delayed   Completed   Blocked  All Time Blocked
 * CompactionExecutor                2        170 (N/A)               N/A       99022         0                0
 * </pre>
 * Rows carry no prefix and are attributed to the timestamp of the StatusLogger line that opened the report.
 */
public class StatusLoggerTableLayout extends AbstractThreadPoolLayout {

    public StatusLoggerTableLayout(ParserConfig config) {
        this(config, LoggerFactory.getLogger(StatusLoggerTableLayout.class));
    }

    public StatusLoggerTableLayout(ParserConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public String getName() {
        return "statusLoggerTable";
    }

    @Override
    protected LineVisitor newVisitor(ThreadPoolAccumulator accumulator) {
        return new ReportBlockVisitor() {
            @Override
            protected void onBlockLine(String trimmed, PoolHeader header, Instant reportTimestamp) {
                rowParser.parse(trimmed, header).ifPresent(
                        row -> accumulator.accumulate(reportTimestamp, row.getPoolName(), row.getMetrics()));
            }
        };
    }
}
