package com.cassandra.log.parser;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.cassandra.log.parser.model.ParsedTimeSeries;

/**
 * Writes each non-empty result family as {@code <base>-<family>.csv} with one row per timestamp.
 */
public class CsvReportWriter {

    private CsvReportWriter() {
    }

    public static List<File> write(File directory, String baseName, SystemLogResult result) throws IOException {
        if (!directory.exists() && !directory.mkdirs()) {
            throw new IOException("Could not create directory " + directory);
        }
        List<File> written = new ArrayList<>();
        for (Map.Entry<String, ParsedTimeSeries> family : result.asMap().entrySet()) {
            if (family.getValue().isEmpty()) {
                continue;
            }
            File file = new File(directory, baseName + "-" + family.getKey() + ".csv");
            try (PrintWriter writer = new PrintWriter(file, StandardCharsets.UTF_8)) {
                writeSeries(writer, family.getValue());
            }
            written.add(file);
        }
        return written;
    }

    static void writeSeries(PrintWriter writer, ParsedTimeSeries series) {
        StringBuilder header = new StringBuilder("timestamp");
        for (String name : series.getSeries().keySet()) {
            header.append(',').append(escape(name));
        }
        writer.println(header);

        for (int i = 0; i < series.size(); i++) {
            StringBuilder row = new StringBuilder(series.getTimestamps().get(i).toString());
            for (List<Double> values : series.getSeries().values()) {
                row.append(',').append(format(values.get(i)));
            }
            writer.println(row);
        }
    }

    static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static String escape(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
