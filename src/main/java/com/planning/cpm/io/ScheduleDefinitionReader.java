package com.planning.cpm.io;

import com.planning.cpm.error.InvalidRecordException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads schedule documents with Jackson.
 *
 * <p>
 * Expected shape:
 *
 * <pre>
 * { "schedule": { "name": "...", "dateMode": "USE_COMPUTED_OFFSETS", "delimiter": "COMMA",
 *     "calendarAnchor": "01/03/2024",
 *     "activities": [ { "ActivityID": "A", "ActivityName": "Excavation", "Duration": 5,
 *                       "Predecessors": "", "Constraint": "" } ] } }
 * </pre>
 */
public final class ScheduleDefinitionReader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);

    private ScheduleDefinitionReader() {
        // Utility class
    }

    /** Parses a JSON file into a ScheduleDefinition. */
    public static ScheduleDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses a JSON string into a ScheduleDefinition.
     *
     * @throws InvalidRecordException if the text is not a schedule document.
     */
    public static ScheduleDefinition parse(String json) {
        ScheduleDefinition def;
        try {
            def = MAPPER.readValue(json, ScheduleDefinition.class);
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException("Malformed schedule document: " + e.getOriginalMessage(), e);
        }
        if (def == null || def.getSchedule() == null)
            throw new InvalidRecordException("Missing 'schedule' key", null);
        return def;
    }
}
