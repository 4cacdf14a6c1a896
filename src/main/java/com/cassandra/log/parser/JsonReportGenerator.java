package com.cassandra.log.parser;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.cassandra.log.parser.model.DataQuality;
import com.cassandra.log.parser.model.ParsedTimeSeries;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Generates structured JSON reports from system.log extraction results
 */
public class JsonReportGenerator {

    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonReportGenerator() {
    }

    public static void generateReport(String fileName, Map<String, SystemLogResult> results) throws IOException {
        ObjectNode report = buildReport(results);
        try (FileWriter writer = new FileWriter(fileName, StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, report);
        }
    }

    public static ObjectNode buildReport(Map<String, SystemLogResult> results) {
        ObjectNode report = mapper.createObjectNode();

        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("generatedAt", Instant.now().toString());
        metadata.put("fileCount", results.size());
        report.set("metadata", metadata);

        ObjectNode files = mapper.createObjectNode();
        for (Map.Entry<String, SystemLogResult> entry : results.entrySet()) {
            SystemLogResult result = entry.getValue();
            ObjectNode file = mapper.createObjectNode();
            file.put("lineCount", result.getLineCount());
            file.set("dataQuality", generateDataQualityJson(result.getDataQuality()));
            for (Map.Entry<String, ParsedTimeSeries> family : result.asMap().entrySet()) {
                file.set(family.getKey(), generateSeriesJson(family.getValue()));
            }
            files.set(entry.getKey(), file);
        }
        report.set("files", files);
        return report;
    }

    static JsonNode generateDataQualityJson(DataQuality quality) {
        ObjectNode node = mapper.createObjectNode();
        node.put("score", quality.getScore());
        node.put("hasGcEvents", quality.hasGcEvents());
        node.put("hasThreadPools", quality.hasThreadPools());
        node.put("hasTombstones", quality.hasTombstones());
        node.put("hasSlowReads", quality.hasSlowReads());
        node.put("gcEventCount", quality.getGcEventCount());
        node.put("threadPoolCount", quality.getThreadPoolCount());
        node.put("tombstoneWarningCount", quality.getTombstoneWarningCount());
        node.put("slowReadCount", quality.getSlowReadCount());
        node.put("statusEventCount", quality.getStatusEventCount());
        node.put("totalTimestamps", quality.getTotalTimestamps());
        return node;
    }

    static JsonNode generateSeriesJson(ParsedTimeSeries series) {
        ObjectNode node = mapper.createObjectNode();

        ArrayNode timestamps = mapper.createArrayNode();
        for (Instant timestamp : series.getTimestamps()) {
            timestamps.add(timestamp.toString());
        }
        node.set("timestamps", timestamps);

        ObjectNode values = mapper.createObjectNode();
        for (Map.Entry<String, List<Double>> entry : series.getSeries().entrySet()) {
            ArrayNode array = mapper.createArrayNode();
            entry.getValue().forEach(array::add);
            values.set(entry.getKey(), array);
        }
        node.set("series", values);

        // Metadata holds maps, lists and entry beans
        node.set("metadata", mapper.valueToTree(series.getMetadata()));
        return node;
    }
}
