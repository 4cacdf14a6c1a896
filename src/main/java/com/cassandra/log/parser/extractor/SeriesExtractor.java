package com.cassandra.log.parser.extractor;

import java.util.List;

import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Turns the lines of one system.log into one family of time series.
 * Implementations keep no state between calls and never return null.
 */
public interface SeriesExtractor {

    String getName();

    ParsedTimeSeries extract(List<String> lines);
}
