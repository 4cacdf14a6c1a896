package com.cassandra.log.parser.extractor.threadpool;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.accumulator.ThreadPoolAccumulator;

/**
 * Last resort when no table could be read: qualified-name-like tokens ({@code TPC/all/READ},
 * {@code system.local}) on StatusLogger lines are registered as pools without values, all at one
 * synthetic timestamp. This can mistake keyspace or table names for pools; the result is marked degraded.
 */
public class QualifiedNameRecoveryLayout extends AbstractThreadPoolLayout {

    private static final Pattern QUALIFIED_NAME_PATTERN =
            Pattern.compile("(?<![\\w./-])([A-Za-z_][\\w-]*(?:[./][A-Za-z_][\\w-]*)+)(?![\\w./-])");

    public QualifiedNameRecoveryLayout(ParserConfig config) {
        this(config, LoggerFactory.getLogger(QualifiedNameRecoveryLayout.class));
    }

    public QualifiedNameRecoveryLayout(ParserConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public String getName() {
        return "qualifiedNameRecovery";
    }

    @Override
    public boolean isDegraded() {
        return true;
    }

    @Override
    protected LineVisitor newVisitor(ThreadPoolAccumulator accumulator) {
        return new LineVisitor() {

            private Instant syntheticTimestamp;

            @Override
            public void visit(String line) {
                if (!isStatusLogger(line)) {
                    return;
                }
                if (syntheticTimestamp == null) {
                    Optional<Instant> timestamp = timestamps.extract(line);
                    timestamp.ifPresent(ts -> syntheticTimestamp = ts);
                }
                Matcher m = QUALIFIED_NAME_PATTERN.matcher(contentAfterDash(line));
                while (m.find()) {
                    String name = m.group(1);
                    if (!name.endsWith(".java")) {
                        accumulator.registerPool(name);
                    }
                }
            }

            @Override
            public void finish() {
                if (accumulator.getPoolCount() > 0) {
                    accumulator.addTimestamp(syntheticTimestamp != null ? syntheticTimestamp : Instant.EPOCH);
                }
            }
        };
    }
}
