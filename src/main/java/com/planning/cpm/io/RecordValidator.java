package com.planning.cpm.io;

import com.planning.cpm.api.DateWindow;
import com.planning.cpm.config.EngineConfig;
import com.planning.cpm.error.InvalidRecordException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts raw document rows into {@link ActivityRecord}s, once, at
 * ingestion.
 *
 * <p>
 * Constraint column resolution per row: {@code Constraint} is read first, then
 * {@code LogicConstraints}. If either yields at least one relation, the
 * {@code Predecessors} column is ignored for that row; otherwise its bare ids
 * become finish-to-start relations with no lag.
 */
public final class RecordValidator {
    private final EngineConfig config;
    private final ConstraintParser parser;

    public RecordValidator(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.parser = new ConstraintParser(config.delimiter());
    }

    /**
     * @throws InvalidRecordException on the first row that does not fit the schema.
     */
    public List<ActivityRecord> validate(List<ScheduleDefinition.ActivityRow> rows) {
        List<ActivityRecord> records = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows == null)
            return records;
        for (int i = 0; i < rows.size(); i++)
            records.add(validate(i, rows.get(i)));
        return records;
    }

    public ActivityRecord validate(int row, ScheduleDefinition.ActivityRow raw) {
        if (raw == null)
            throw new InvalidRecordException(row, "ActivityID", "row is empty");
        String id = raw.getActivityId() == null ? "" : raw.getActivityId().strip();
        if (id.isEmpty())
            throw new InvalidRecordException(row, "ActivityID", "activity id is required");
        if (raw.getDuration() == null)
            throw new InvalidRecordException(row, "Duration", "duration is required for activity " + id);

        String name = raw.getActivityName() == null || raw.getActivityName().isBlank()
                ? id
                : raw.getActivityName().strip();

        List<ConstraintRelation> relations = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String column : new String[] { raw.getConstraint(), raw.getLogicConstraints() }) {
            ParsedConstraints parsed = parser.parse(column);
            skipped.addAll(parsed.skipped());
            if (!parsed.isEmpty()) {
                relations.addAll(parsed.relations());
                break;
            }
        }
        if (relations.isEmpty())
            relations.addAll(ConstraintParser.parsePredecessors(raw.getPredecessors()));

        LocalDate start = parseDate(row, "StartDate", raw.getStartDate());
        LocalDate end = parseDate(row, "EndDate", raw.getEndDate());
        if (start != null && end != null && end.isBefore(start))
            throw new InvalidRecordException(row, "EndDate", "end date " + end + " precedes start date " + start);
        DateWindow window = start == null && end == null ? null : new DateWindow(start, end);

        return new ActivityRecord(row, id, name, raw.getDuration(), relations, skipped, window);
    }

    private LocalDate parseDate(int row, String field, String text) {
        if (text == null || text.isBlank())
            return null;
        try {
            return LocalDate.parse(text.strip(), config.dateFormatter());
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException(row, field,
                    "'" + text + "' does not match " + config.dateFormat(), e);
        }
    }
}
