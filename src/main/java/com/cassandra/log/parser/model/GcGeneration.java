package com.cassandra.log.parser.model;

import java.util.Locale;

/**
 * Heap generation a GC pause was attributed to.
 */
public enum GcGeneration {

    YOUNG("young"),
    OLD("old"),
    UNKNOWN("unknown");

    private final String tag;

    GcGeneration(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Classifies a GCInspector line by keyword. Young keywords are checked first because
     * young collections also print old generation pool sizes ("CMS Old Gen: ...").
     */
    public static GcGeneration classify(String line) {
        if (line == null) {
            return UNKNOWN;
        }
        String lc = line.toLowerCase(Locale.ROOT);

        boolean young = lc.contains("young generation")
                || lc.contains("young gen")
                || lc.contains("parnew")
                || lc.contains("ps scavenge")
                || (lc.contains("young") && !lc.contains("old"));
        if (young) {
            return YOUNG;
        }

        boolean old = lc.contains("old generation")
                || lc.contains("old gen")
                || lc.contains("full gc")
                || lc.contains("concurrentmarksweep")
                || lc.contains("marksweep");
        if (old) {
            return OLD;
        }
        return UNKNOWN;
    }
}
