package com.cassandra.log.parser;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cassandra.log.config.ParserConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command line front end: reads Cassandra/DSE system.log files and writes the extracted time series
 * as JSON, CSV or a console summary. Files are processed independently.
 */
@Command(name = "systemLogParser", mixinStandardHelpOptions = true, version = "1.0",
         description = "Extract GC, thread pool, tombstone and slow read time series from Cassandra system.log files")
public class LogParser implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(LogParser.class);

    static final String BASE_LOGGER = "com.cassandra.log";

    @Option(names = { "-f", "--files" }, description = "system.log file(s), optionally .gz or .zip", required = true, arity = "1..*")
    private String[] fileNames;

    @Option(names = { "--config" }, description = "Parser configuration file")
    private String configFile;

    @Option(names = { "--json" }, description = "JSON output file for structured report data")
    private String jsonOutputFile;

    @Option(names = { "--csvDir" }, description = "Directory for one CSV file per result family and input file")
    private String csvDir;

    @Option(names = { "--text" }, description = "Enable text output to console")
    private boolean textOutput = false;

    @Option(names = { "--parallel" }, description = "Run the extractors of each file concurrently")
    private boolean parallel = false;

    @Option(names = { "--debug" }, description = "Enable debug logging")
    private boolean debug = false;

    @Option(names = { "--limit" }, description = "Limit parsing to the first N lines of each log file")
    private Long lineLimit = null;

    private final ParserConfig parserConfig = new ParserConfig();

    @Override
    public Integer call() throws Exception {
        if (debug) {
            enableDebugLogging();
        }
        loadConfiguration();
        if (parallel) {
            parserConfig.setParallel(true);
        }

        Map<String, SystemLogResult> results = read();
        if (results.isEmpty()) {
            System.err.println("No files were successfully processed. Exiting without generating reports.");
            return 1;
        }

        if (textOutput || (jsonOutputFile == null && csvDir == null)) {
            results.forEach((name, result) -> TextReportGenerator.report(name, result, System.out));
        }

        if (jsonOutputFile != null) {
            System.out.println("Generating JSON report: " + jsonOutputFile);
            JsonReportGenerator.generateReport(jsonOutputFile, results);
        }

        if (csvDir != null) {
            File dir = new File(csvDir);
            for (Map.Entry<String, SystemLogResult> entry : results.entrySet()) {
                List<File> written = CsvReportWriter.write(dir, entry.getKey(), entry.getValue());
                logger.info("Wrote {} CSV file(s) for {} to {}", written.size(), entry.getKey(), dir);
            }
        }
        return 0;
    }

    Map<String, SystemLogResult> read() {
        SystemLogParser parser = new SystemLogParser(parserConfig);
        Map<String, SystemLogResult> results = new LinkedHashMap<>();

        for (String fileName : fileNames) {
            File file = new File(fileName);
            if (!file.isFile()) {
                System.err.println("File not found: " + fileName);
                continue;
            }
            long start = System.currentTimeMillis();
            try {
                List<String> lines = LogFileReader.readLines(file, lineLimit);
                SystemLogResult result = parser.parseLines(lines);
                String key = results.containsKey(file.getName()) ? file.getPath() : file.getName();
                results.put(key, result);
                logger.info("Processed {} ({} lines) in {} ms, data quality {}", fileName, lines.size(),
                        System.currentTimeMillis() - start, result.getDataQuality().getScore());
            } catch (IOException e) {
                System.err.println("Error reading " + fileName + ": " + e.getMessage());
                logger.debug("Read failure", e);
            } catch (LogParseException e) {
                System.err.println("Error parsing " + fileName + ": " + e.getMessage());
                logger.debug("Parse failure", e);
            }
        }
        return results;
    }

    private void loadConfiguration() {
        if (configFile != null) {
            try (InputStream in = new FileInputStream(configFile)) {
                Properties props = new Properties();
                props.load(in);
                parserConfig.loadFromProperties(props);
                logger.info("Loaded parser configuration from: {}", configFile);
            } catch (IOException e) {
                logger.warn("Could not load config file: {}. Using defaults.", configFile);
            }
        }
    }

    private void enableDebugLogging() {
        Logger base = LoggerFactory.getLogger(BASE_LOGGER);
        if (base instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) base).setLevel(Level.DEBUG);
        } else {
            logger.warn("Debug logging requested but the logging backend is not Logback");
        }
    }

    ParserConfig getParserConfig() {
        return parserConfig;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LogParser()).execute(args);
        System.exit(exitCode);
    }
}
