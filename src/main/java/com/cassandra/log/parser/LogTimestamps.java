package com.cassandra.log.parser;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the timestamp encodings found in system.log and tpstats output and
 * normalizes them to an {@link Instant}.
 * <ul>
 * <li>ISO-8601 with an explicit offset: {@code 2025-02-27T13:24:23+0100}, {@code 2023-06-15T10:15:23.456Z}</li>
 * <li>Log4j/logback local form: {@code 2023-06-15 10:15:23,456}</li>
 * </ul>
 * Local timestamps carry no zone and are read in the configured zone.
 */
public class LogTimestamps {

    private static final Pattern ISO_OFFSET_PATTERN = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2})T(\\d{2}:\\d{2}:\\d{2})(?:[.,](\\d{1,9}))?(Z|[+-]\\d{2}:?\\d{2})");

    private static final Pattern LOCAL_PATTERN = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2})[ T](\\d{2}:\\d{2}:\\d{2})(?:[.,](\\d{1,9}))?");

    private final ZoneId zone;

    public LogTimestamps() {
        this(ZoneOffset.UTC);
    }

    public LogTimestamps(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Finds the first timestamp on the line. Returns empty when none can be parsed.
     */
    public Optional<Instant> extract(String line) {
        if (line == null || line.length() < 19) {
            return Optional.empty();
        }
        Matcher iso = ISO_OFFSET_PATTERN.matcher(line);
        Matcher local = LOCAL_PATTERN.matcher(line);
        boolean isoFound = iso.find();
        boolean localFound = local.find();

        // A local match starting at the same place as an ISO match is the same token without its offset
        if (isoFound && (!localFound || iso.start() <= local.start())) {
            return parseOffset(iso.group(1), iso.group(2), iso.group(3), iso.group(4));
        }
        if (localFound) {
            return parseLocal(local.group(1), local.group(2), local.group(3));
        }
        return Optional.empty();
    }

    /**
     * Parses a string that is expected to be just a timestamp, in either encoding.
     */
    public Optional<Instant> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return extract(text.trim());
    }

    private Optional<Instant> parseOffset(String date, String time, String fraction, String offset) {
        String normalizedOffset = offset;
        if (!"Z".equals(offset) && offset.indexOf(':') < 0) {
            normalizedOffset = offset.substring(0, 3) + ":" + offset.substring(3);
        }
        String text = date + "T" + time + normalizeFraction(fraction) + normalizedOffset;
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> parseLocal(String date, String time, String fraction) {
        String text = date + "T" + time + normalizeFraction(fraction);
        try {
            return Optional.of(LocalDateTime.parse(text).atZone(zone).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    // Comma separated milliseconds become a regular ISO fraction
    private static String normalizeFraction(String fraction) {
        return fraction == null ? "" : "." + fraction;
    }
}
