package com.cassandra.log.parser.extractor.threadpool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.cassandra.log.parser.model.PoolMetric;

/**
 * Column layout announced by a {@code Pool Name ...} header line.
 * <p>
 * Each column maps to a canonical {@link PoolMetric}, or to null when the header word is not
 * recognized. A parenthesised header word such as {@code (w/Backpressure)} is not a column of its
 * own: it qualifies the preceding column, whose row values then carry a parenthesised extra value.
 */
public class PoolHeader {

    private final List<PoolMetric> columns;
    private final Map<Integer, PoolMetric> qualifiers;

    PoolHeader(List<PoolMetric> columns, Map<Integer, PoolMetric> qualifiers) {
        this.columns = Collections.unmodifiableList(columns);
        this.qualifiers = Collections.unmodifiableMap(qualifiers);
    }

    public static boolean isHeader(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return (lower.contains("pool name") || lower.contains("poolname")) && lower.contains("active");
    }

    /**
     * Parses the header words following {@code Pool Name}. Any log prefix before it is ignored.
     */
    public static PoolHeader parse(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int start = lower.indexOf("pool name");
        int skip = "pool name".length();
        if (start < 0) {
            start = lower.indexOf("poolname");
            skip = "poolname".length();
        }
        String words = start < 0 ? text : text.substring(start + skip);

        List<PoolMetric> columns = new ArrayList<>();
        Map<Integer, PoolMetric> qualifiers = new HashMap<>();
        String[] tokens = words.trim().split("\\s+");

        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.isEmpty()) {
                continue;
            }
            if (token.startsWith("(")) {
                StringBuilder qualifier = new StringBuilder(token);
                while (!qualifier.toString().endsWith(")") && i + 1 < tokens.length) {
                    qualifier.append(' ').append(tokens[++i]);
                }
                if (!columns.isEmpty()) {
                    int previous = columns.size() - 1;
                    PoolMetric metric = PoolMetric.fromHeaderWord(qualifier.toString());
                    if (metric == PoolMetric.BACKPRESSURE || columns.get(previous) == PoolMetric.PENDING) {
                        qualifiers.put(previous, PoolMetric.BACKPRESSURE);
                    }
                }
                continue;
            }
            if (token.equalsIgnoreCase("all") && i + 2 < tokens.length
                    && tokens[i + 1].equalsIgnoreCase("time") && tokens[i + 2].toLowerCase(Locale.ROOT).startsWith("blocked")) {
                columns.add(PoolMetric.ALL_TIME_BLOCKED);
                i += 2;
                continue;
            }
            columns.add(PoolMetric.fromHeaderWord(token));
        }
        return new PoolHeader(columns, qualifiers);
    }

    public int getColumnCount() {
        return columns.size();
    }

    public PoolMetric getColumn(int index) {
        return columns.get(index);
    }

    public List<PoolMetric> getColumns() {
        return columns;
    }

    /** Metric carried by a parenthesised value following the given column, or null. */
    public PoolMetric getQualifier(int index) {
        return qualifiers.get(index);
    }

    @Override
    public String toString() {
        return "PoolHeader" + columns;
    }
}
