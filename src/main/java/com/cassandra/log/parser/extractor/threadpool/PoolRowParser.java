package com.cassandra.log.parser.extractor.threadpool;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.cassandra.log.config.ParserConfig;
import com.cassandra.log.parser.model.PoolMetric;

/**
 * Splits a pool line into its name and values and maps the values to metrics.
 * <p>
 * The name is the leading run of words separated by single spaces, ended by two or more spaces
 * or a tab. Values are integers or {@code N/A}, which reads as 0. A parenthesised value qualifies
 * the value before it. Anything that does not look like a pool row is rejected rather than guessed.
 */
public class PoolRowParser {

    private static final Pattern NAME_PATTERN = Pattern.compile("^(\\S+(?: \\S+)*?)(?:\\s{2,}|\\t)\\s*(.+)$");
    private static final Pattern FIRST_TOKEN_PATTERN = Pattern.compile("^(\\S+)\\s+((?:\\d+|N/A|n/a).*)$");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d+");
    private static final Pattern LOG_ENTRY_PATTERN = Pattern.compile("^(?:INFO|WARN|ERROR|DEBUG|TRACE|FATAL)\\b");

    private static final int MIN_VALUES = 2;

    private final ParserConfig config;
    private final List<String> skipKeywords = new ArrayList<>();

    public PoolRowParser(ParserConfig config) {
        this.config = config;
        for (String keyword : config.getSkipKeywords()) {
            skipKeywords.add(keyword.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Parses one row. The header is used for column mapping when its column count matches the
     * number of values; otherwise the positional schema for the value count applies.
     *
     * @param header the current column header, may be null
     */
    public Optional<PoolRow> parse(String line, PoolHeader header) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (trimmed.length() < config.getMinRowLength() || trimmed.indexOf(',') >= 0
                || isLogEntry(trimmed) || PoolHeader.isHeader(trimmed) || hasSkipKeyword(trimmed)) {
            return Optional.empty();
        }

        String name;
        String rest;
        Matcher m = NAME_PATTERN.matcher(trimmed);
        Matcher fallback = FIRST_TOKEN_PATTERN.matcher(trimmed);
        if (m.matches() && !(fallback.matches() && containsValueWord(m.group(1)))) {
            name = m.group(1);
            rest = m.group(2);
        } else if (fallback.matches()) {
            name = fallback.group(1);
            rest = fallback.group(2);
        } else {
            return Optional.empty();
        }
        if (!isValidName(name)) {
            return Optional.empty();
        }

        List<Long> values = new ArrayList<>();
        Map<Integer, Long> qualified = new LinkedHashMap<>();
        for (String token : rest.trim().split("\\s+")) {
            if (token.startsWith("(") && token.endsWith(")") && token.length() > 2) {
                Long value = parseValue(token.substring(1, token.length() - 1));
                if (value == null) {
                    return Optional.empty();
                }
                if (!values.isEmpty()) {
                    qualified.put(values.size() - 1, value);
                }
                continue;
            }
            Long value = parseValue(token);
            if (value == null) {
                return Optional.empty();
            }
            values.add(value);
        }
        if (values.size() < MIN_VALUES) {
            return Optional.empty();
        }
        return Optional.of(new PoolRow(name, map(values, qualified, header)));
    }

    private Map<PoolMetric, Long> map(List<Long> values, Map<Integer, Long> qualified, PoolHeader header) {
        Map<PoolMetric, Long> metrics = new EnumMap<>(PoolMetric.class);
        boolean byHeader = header != null && header.getColumnCount() == values.size();
        List<PoolMetric> columns = byHeader
                ? header.getColumns()
                : PoolSchema.forValueCount(values.size()).getColumns();

        int count = Math.min(values.size(), columns.size());
        for (int i = 0; i < count; i++) {
            PoolMetric metric = columns.get(i);
            if (metric != null) {
                metrics.put(metric, values.get(i));
            }
        }
        for (Map.Entry<Integer, Long> entry : qualified.entrySet()) {
            int index = entry.getKey();
            if (index >= count) {
                continue;
            }
            PoolMetric qualifier = byHeader ? header.getQualifier(index) : null;
            if (qualifier == null && columns.get(index) == PoolMetric.PENDING) {
                qualifier = PoolMetric.BACKPRESSURE;
            }
            if (qualifier != null) {
                metrics.put(qualifier, entry.getValue());
            }
        }
        return metrics;
    }

    /**
     * True for names that could be a pool: not numeric, at least two characters, no ellipsis,
     * no bracketed marker, no comma and no log level.
     */
    public boolean isValidName(String name) {
        if (name == null || name.length() < 2) {
            return false;
        }
        if (NUMBER_PATTERN.matcher(name).matches() || name.equals("...") || isNotApplicable(name)) {
            return false;
        }
        if ((name.contains("[") && name.contains("]")) || name.indexOf(',') >= 0) {
            return false;
        }
        return !isLogEntry(name) && !hasSkipKeyword(name);
    }

    /**
     * True when every token of the line is a value or a parenthesised value.
     */
    public static boolean isValueOnly(String trimmed) {
        if (trimmed.isEmpty()) {
            return false;
        }
        for (String token : trimmed.split("\\s+")) {
            String value = token;
            if (token.startsWith("(") && token.endsWith(")") && token.length() > 2) {
                value = token.substring(1, token.length() - 1);
            }
            if (parseValue(value) == null) {
                return false;
            }
        }
        return true;
    }

    // Single spaced values swallowed into the name
    private static boolean containsValueWord(String name) {
        String[] words = name.split(" ");
        for (int i = 1; i < words.length; i++) {
            if (parseValue(words[i]) != null) {
                return true;
            }
        }
        return false;
    }

    public static boolean isLogEntry(String trimmed) {
        return LOG_ENTRY_PATTERN.matcher(trimmed).find();
    }

    static Long parseValue(String token) {
        if (isNotApplicable(token)) {
            return 0L;
        }
        if (!NUMBER_PATTERN.matcher(token).matches()) {
            return null;
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            // longer than a long
            return null;
        }
    }

    private static boolean isNotApplicable(String token) {
        return token.equalsIgnoreCase("N/A");
    }

    private boolean hasSkipKeyword(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : skipKeywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
