package com.cassandra.log.parser.extractor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.LineCategory;
import com.cassandra.log.parser.TimestampTracker;
import com.cassandra.log.parser.accumulator.GcEventAccumulator;
import com.cassandra.log.parser.model.GcGeneration;
import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Extracts GC pauses reported by GCInspector.
 * <p>
 * Each GCInspector line is tried against the {@link GcRule} cascade and the first rule that
 * matches wins. A tagged line that mentions "ms" but matches no rule is still recorded with
 * the configured estimated duration: a missing pause skews the event count more than one
 * inaccurate duration does.
 */
public class GcEventExtractor extends AbstractSeriesExtractor {

    public GcEventExtractor(ParserConfig config) {
        this(config, LoggerFactory.getLogger(GcEventExtractor.class));
    }

    public GcEventExtractor(ParserConfig config, Logger logger) {
        super(config, logger);
    }

    @Override
    public String getName() {
        return "gcEvents";
    }

    @Override
    public ParsedTimeSeries extract(List<String> lines) {
        GcEventAccumulator accumulator = new GcEventAccumulator();
        TimestampTracker tracker = new TimestampTracker(timestamps);

        forEachLine(lines, null, line -> {
            if (classifier.classify(line) != LineCategory.GC_EVENT) {
                tracker.update(line);
                return;
            }
            Optional<Instant> lineTimestamp = tracker.update(line);
            Instant context = tracker.current().orElse(null);
            if (!applyRules(line, lineTimestamp.orElse(null), context, accumulator)) {
                logger.debug("Unmatched GCInspector line: {}", preview(line));
            }
        });

        long fallbacks = 0;
        for (GcRule rule : GcRule.values()) {
            if (rule.isFallback() && rule != GcRule.ESTIMATED) {
                fallbacks += accumulator.getRuleCount(rule.name());
            }
        }
        logger.debug("GC events: {} ({} primary, {} fallback, {} estimated)", accumulator.getEventCount(),
                accumulator.getRuleCount(GcRule.PRIMARY.name()), fallbacks,
                accumulator.getRuleCount(GcRule.ESTIMATED.name()));
        return accumulator.toTimeSeries();
    }

    private boolean applyRules(String line, Instant lineTimestamp, Instant context, GcEventAccumulator accumulator) {
        for (GcRule rule : GcRule.values()) {
            if (rule == GcRule.ESTIMATED) {
                if (!line.contains("ms")) {
                    return false;
                }
                Instant ts = lineTimestamp != null ? lineTimestamp : context;
                if (ts == null) {
                    return false;
                }
                accumulator.accumulate(ts, config.getEstimatedGcDurationMs(), GcGeneration.classify(line),
                        rule.name(), "ESTIMATED: " + preview(line));
                return true;
            }

            Matcher m = rule.getPattern().matcher(line);
            if (!m.find()) {
                continue;
            }

            Instant ts;
            if (rule.getTimestampGroup() > 0) {
                ts = timestamps.parse(m.group(rule.getTimestampGroup())).orElse(null);
            } else {
                ts = lineTimestamp;
            }
            if (ts == null && rule.isContextTimestampAllowed()) {
                ts = context;
            }
            if (ts == null) {
                continue;
            }

            long duration;
            try {
                duration = Long.parseLong(m.group(rule.getDurationGroup()));
            } catch (NumberFormatException e) {
                logger.debug("{}: duration out of range, trying next rule: {}", rule, preview(line));
                continue;
            }
            String description = rule.getDescriptionGroup() > 0
                    ? m.group(rule.getDescriptionGroup()).trim()
                    : "FALLBACK: " + preview(line);

            accumulator.accumulate(ts, duration, GcGeneration.classify(line), rule.name(), description);
            return true;
        }
        return false;
    }
}
