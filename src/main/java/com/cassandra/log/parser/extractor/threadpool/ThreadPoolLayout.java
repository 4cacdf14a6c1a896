package com.cassandra.log.parser.extractor.threadpool;

import java.util.List;

/**
 * One known textual layout of StatusLogger thread pool reports. Layouts are tried in order
 * over the whole document; each attempt starts from empty state.
 */
public interface ThreadPoolLayout {

    String getName();

    LayoutAttempt attempt(List<String> lines);

    /**
     * Degraded layouts recover pool names without values.
     */
    default boolean isDegraded() {
        return false;
    }
}
