package com.cassandra.log.parser.extractor.threadpool;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.accumulator.ThreadPoolAccumulator;

/**
 * Wrapped multi-line report where long pool names push the values onto the next line:
 * <pre>
 * Pool Name                                    Active   Pending   Completed   Blocked  All Time Blocked
 * TPC/all/READ_DISK_ASYNC
 *                                                 1869        20      100000         0               100
 * </pre>
 * Rows that did fit on one line are accepted as well.
 */
public class SplitRowLayout extends AbstractThreadPoolLayout {

    public SplitRowLayout(ParserConfig config) {
        this(config, LoggerFactory.getLogger(SplitRowLayout.class));
    }

    public SplitRowLayout(ParserConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public String getName() {
        return "splitRow";
    }

    @Override
    protected LineVisitor newVisitor(ThreadPoolAccumulator accumulator) {
        return new ReportBlockVisitor() {

            private String pendingName;

            @Override
            protected void onBlockLine(String trimmed, PoolHeader header, Instant reportTimestamp) {
                if (PoolRowParser.isValueOnly(trimmed)) {
                    if (pendingName != null) {
                        rowParser.parse(pendingName + "  " + trimmed, header).ifPresent(
                                row -> accumulator.accumulate(reportTimestamp, row.getPoolName(), row.getMetrics()));
                    }
                    pendingName = null;
                    return;
                }
                if (trimmed.indexOf(' ') < 0 && trimmed.indexOf('\t') < 0) {
                    pendingName = rowParser.isValidName(trimmed) ? trimmed : null;
                    return;
                }
                pendingName = null;
                rowParser.parse(trimmed, header).ifPresent(
                        row -> accumulator.accumulate(reportTimestamp, row.getPoolName(), row.getMetrics()));
            }

            @Override
            protected void onBlockEnd() {
                pendingName = null;
            }
        };
    }
}
