package com.cassandra.log.parser;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads a system.log, plain or compressed, into memory. Compression is chosen by file extension.
 */
public class LogFileReader {

    private static final int BUFFER_SIZE = 1024 * 1024;

    private LogFileReader() {
    }

    /**
     * @param lineLimit maximum number of lines to read, null for all
     */
    public static List<String> readLines(File file, Long lineLimit) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = createReader(file)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (lineLimit != null && lines.size() >= lineLimit) {
                    break;
                }
                lines.add(line);
            }
        }
        return lines;
    }

    static BufferedReader createReader(File file) throws IOException {
        String name = file.getName().toLowerCase(Locale.ROOT);
        InputStream in = new FileInputStream(file);
        try {
            if (name.endsWith(".gz")) {
                in = new GZIPInputStream(in);
            } else if (name.endsWith(".zip")) {
                ZipInputStream zip = new ZipInputStream(in);
                in = zip;
                ZipEntry entry = zip.getNextEntry();
                while (entry != null && entry.isDirectory()) {
                    entry = zip.getNextEntry();
                }
                if (entry == null) {
                    throw new IOException("No file entry in " + file);
                }
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), BUFFER_SIZE);
    }
}
