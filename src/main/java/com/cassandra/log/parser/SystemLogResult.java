package com.cassandra.log.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.cassandra.log.parser.model.DataQuality;
import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Everything extracted from one system.log.
 */
public class SystemLogResult {

    private final ParsedTimeSeries gcEvents;
    private final ParsedTimeSeries threadPoolMetrics;
    private final ParsedTimeSeries tombstoneWarnings;
    private final ParsedTimeSeries slowReads;
    private final ParsedTimeSeries statusEvents;
    private final DataQuality dataQuality;
    private final int lineCount;

    public SystemLogResult(ParsedTimeSeries gcEvents, ParsedTimeSeries threadPoolMetrics,
            ParsedTimeSeries tombstoneWarnings, ParsedTimeSeries slowReads, ParsedTimeSeries statusEvents,
            int lineCount) {
        this.gcEvents = gcEvents;
        this.threadPoolMetrics = threadPoolMetrics;
        this.tombstoneWarnings = tombstoneWarnings;
        this.slowReads = slowReads;
        this.statusEvents = statusEvents;
        this.lineCount = lineCount;
        this.dataQuality = new DataQuality(gcEvents, threadPoolMetrics, tombstoneWarnings, slowReads, statusEvents);
    }

    public static SystemLogResult empty() {
        return new SystemLogResult(ParsedTimeSeries.empty(), ParsedTimeSeries.empty(), ParsedTimeSeries.empty(),
                ParsedTimeSeries.empty(), ParsedTimeSeries.empty(), 0);
    }

    public ParsedTimeSeries getGcEvents() {
        return gcEvents;
    }

    public ParsedTimeSeries getThreadPoolMetrics() {
        return threadPoolMetrics;
    }

    public ParsedTimeSeries getTombstoneWarnings() {
        return tombstoneWarnings;
    }

    public ParsedTimeSeries getSlowReads() {
        return slowReads;
    }

    public ParsedTimeSeries getStatusEvents() {
        return statusEvents;
    }

    public DataQuality getDataQuality() {
        return dataQuality;
    }

    public int getLineCount() {
        return lineCount;
    }

    /**
     * Results keyed by family name, in report order.
     */
    public Map<String, ParsedTimeSeries> asMap() {
        Map<String, ParsedTimeSeries> map = new LinkedHashMap<>();
        map.put("gcEvents", gcEvents);
        map.put("threadPoolMetrics", threadPoolMetrics);
        map.put("tombstoneWarnings", tombstoneWarnings);
        map.put("slowReads", slowReads);
        map.put("statusEvents", statusEvents);
        return Collections.unmodifiableMap(map);
    }
}
