package com.cassandra.log.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the sample logs under {@code src/test/resources/logs}.
 */
final class SampleLogs {

    static final String SYSTEM_LOG = "/logs/system.log";

    private SampleLogs() {
    }

    static String load(String resource) {
        try (InputStream in = SampleLogs.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String systemLog() {
        return load(SYSTEM_LOG);
    }
}
