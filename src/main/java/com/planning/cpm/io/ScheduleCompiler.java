package com.planning.cpm.io;

import com.planning.cpm.api.DateWindow;
import com.planning.cpm.config.EngineConfig;
import com.planning.cpm.engine.CompiledSchedule;
import com.planning.cpm.engine.ScheduleGraph;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a {@link ScheduleDefinition} or validated records into a
 * {@link CompiledSchedule}.
 *
 * <p>
 * All activities are declared before any edge, so a constraint may name an
 * activity defined on a later row. Edges are then added row by row in
 * relation order; a later relation for the same (predecessor, successor) pair
 * replaces the earlier one.
 */
public final class ScheduleCompiler {
    private static final Logger log = LogManager.getLogger(ScheduleCompiler.class);

    private final EngineConfig config;

    public ScheduleCompiler(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public CompiledSchedule compile(ScheduleDefinition def) {
        List<ScheduleDefinition.ActivityRow> rows = def.getSchedule() == null
                ? List.of()
                : def.getSchedule().getActivities();
        return compile(new RecordValidator(config).validate(rows));
    }

    /**
     * @throws com.planning.cpm.error.DuplicateActivityException on a repeated id.
     * @throws com.planning.cpm.error.InvalidDurationException   on a negative duration.
     * @throws com.planning.cpm.error.UnknownActivityException   on an undeclared predecessor.
     * @throws com.planning.cpm.error.SelfLoopException          on a row naming itself.
     */
    public CompiledSchedule compile(List<ActivityRecord> records) {
        ScheduleGraph.Builder graph = ScheduleGraph.builder();
        Map<String, DateWindow> suppliedDates = new HashMap<>();
        Map<String, Integer> skippedTokens = new HashMap<>();

        for (ActivityRecord r : records) {
            graph.addActivity(r.id(), r.name(), r.duration());
            if (r.suppliedDates() != null)
                suppliedDates.put(r.id(), r.suppliedDates());
            if (!r.skipped().isEmpty()) {
                skippedTokens.put(r.id(), r.skipped().size());
                log.warn("Activity {} (row {}): skipped {} malformed constraint token(s): {}",
                        r.id(), r.row(), r.skipped().size(), r.skipped());
            }
        }

        for (ActivityRecord r : records) {
            for (ConstraintRelation c : r.relations())
                graph.addEdge(c.predecessorId(), r.id(), c.type(), c.lag());
        }

        return new CompiledSchedule(graph.build(), suppliedDates, skippedTokens);
    }
}
