package com.planning.cpm.engine;

import com.planning.cpm.api.DateWindow;

import java.util.Map;

/**
 * A schedule ready to run: the precedence network plus the per-activity data
 * that travels alongside it from ingestion.
 *
 * @param graph         The precedence network.
 * @param suppliedDates Supplied calendar dates keyed by activity id.
 * @param skippedTokens Number of malformed constraint tokens dropped, keyed by
 *                      activity id; activities without skips are absent.
 */
public record CompiledSchedule(
        ScheduleGraph graph,
        Map<String, DateWindow> suppliedDates,
        Map<String, Integer> skippedTokens) {

    public CompiledSchedule {
        suppliedDates = Map.copyOf(suppliedDates);
        skippedTokens = Map.copyOf(skippedTokens);
    }

    /** Wraps a programmatically built graph with no ingestion data. */
    public static CompiledSchedule of(ScheduleGraph graph) {
        return new CompiledSchedule(graph, Map.of(), Map.of());
    }

    public int totalSkippedTokens() {
        int total = 0;
        for (int skipped : skippedTokens.values())
            total += skipped;
        return total;
    }
}
