package com.planning.cpm.engine;

import com.planning.cpm.api.ActivityTiming;

import java.util.*;

/**
 * Complete timing of one scheduling run.
 *
 * <p>
 * Rows are ordered by ascending ES, ties broken by activity id. The topology
 * the rows were computed from is kept for diagnostics.
 */
public final class ScheduleResult {
    private final List<ActivityTiming> rows;
    private final Map<String, ActivityTiming> rowsById;
    private final ScheduleSummary summary;
    private final TopologicalOrder topology;

    ScheduleResult(List<ActivityTiming> rows, ScheduleSummary summary, TopologicalOrder topology) {
        this.rows = List.copyOf(rows);
        Map<String, ActivityTiming> byId = new HashMap<>(rows.size() * 2);
        for (ActivityTiming row : rows)
            byId.put(row.id(), row);
        this.rowsById = Collections.unmodifiableMap(byId);
        this.summary = summary;
        this.topology = topology;
    }

    public List<ActivityTiming> rows() {
        return rows;
    }

    /**
     * @throws IllegalArgumentException if no activity has this id.
     */
    public ActivityTiming row(String activityId) {
        ActivityTiming row = rowsById.get(activityId);
        if (row == null)
            throw new IllegalArgumentException("Unknown activity: " + activityId);
        return row;
    }

    public ScheduleSummary summary() {
        return summary;
    }

    public int projectDuration() {
        return summary.projectDuration();
    }

    public List<String> criticalPath() {
        return summary.criticalPath();
    }

    public TopologicalOrder topology() {
        return topology;
    }
}
