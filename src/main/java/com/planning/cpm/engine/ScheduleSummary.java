package com.planning.cpm.engine;

import java.util.List;

/**
 * Headline figures of a computed schedule.
 *
 * @param projectDuration Total project duration in days.
 * @param criticalPath    Critical activity ids by ascending ES, ties by id. This
 *                        is the set of critical activities in start order, not a
 *                        verified chain of zero-slack edges.
 * @param skippedTokens   Malformed constraint tokens dropped at ingestion.
 */
public record ScheduleSummary(int projectDuration, List<String> criticalPath, int skippedTokens) {

    public ScheduleSummary {
        criticalPath = List.copyOf(criticalPath);
    }

    public String criticalPathLabel() {
        return String.join(" -> ", criticalPath);
    }
}
