package com.planning.cpm.io;

import com.planning.cpm.api.ActivityTiming;
import com.planning.cpm.engine.ScheduleResult;
import com.planning.cpm.engine.ScheduleSummary;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes a {@link ScheduleResult} to JSON.
 *
 * <p>
 * Row fields use the output column names (ID, Name, Duration, ES, EF, LS, LF,
 * Float, Critical) and, when present, Start/End as ISO-8601 dates.
 */
public final class ScheduleResultWriter {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ScheduleResultWriter() {
        // Utility class
    }

    public static ObjectNode toTree(ScheduleResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        ScheduleSummary summary = result.summary();

        ObjectNode summaryNode = root.putObject("summary");
        summaryNode.put("projectDuration", summary.projectDuration());
        ArrayNode path = summaryNode.putArray("criticalPath");
        summary.criticalPath().forEach(path::add);
        summaryNode.put("skippedTokens", summary.skippedTokens());

        ArrayNode rows = root.putArray("activities");
        for (ActivityTiming t : result.rows()) {
            ObjectNode row = rows.addObject();
            row.put("ID", t.id());
            row.put("Name", t.name());
            row.put("Duration", t.duration());
            row.put("ES", t.earlyStart());
            row.put("EF", t.earlyFinish());
            row.put("LS", t.lateStart());
            row.put("LF", t.lateFinish());
            row.put("Float", t.totalFloat());
            row.put("Critical", t.critical());
            if (t.startDate() != null)
                row.put("Start", t.startDate().toString());
            if (t.endDate() != null)
                row.put("End", t.endDate().toString());
        }
        return root;
    }

    public static String toJson(ScheduleResult result) {
        try {
            return MAPPER.writeValueAsString(toTree(result));
        } catch (JsonProcessingException e) {
            // A tree of primitives always serializes
            throw new UncheckedIOException(e);
        }
    }

    public static void writeFile(ScheduleResult result, Path path) throws IOException {
        Files.writeString(path, toJson(result));
    }
}
