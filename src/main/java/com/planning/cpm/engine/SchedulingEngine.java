package com.planning.cpm.engine;

import com.planning.cpm.api.ScheduleListener;
import com.planning.cpm.api.ScheduleListener.Pass;
import com.planning.cpm.config.EngineConfig;
import com.planning.cpm.error.ScheduleException;

import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives one full scheduling computation.
 *
 * <p>
 * The pipeline is strict and runs from scratch on every call:
 *
 * 1. Validate: cycle check and topological order ({@link ScheduleGraph#validate()}).
 * 2. Forward: ES/EF in topological order ({@link ForwardPass}).
 * 3. Backward: LS/LF in reverse order ({@link BackwardPass}).
 * 4. Compile: float, criticality, rows and summary ({@link ResultCompiler}).
 *
 * Any {@link ScheduleException} stops the pipeline; no partial schedule is
 * returned. The engine keeps no state between runs, so identical input always
 * yields identical output.
 */
public final class SchedulingEngine {
    private static final Logger log = LogManager.getLogger(SchedulingEngine.class);

    private final EngineConfig config;
    private ScheduleListener listener;

    public SchedulingEngine() {
        this(EngineConfig.defaults());
    }

    public SchedulingEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void setListener(ScheduleListener listener) {
        this.listener = listener;
    }

    public EngineConfig config() {
        return config;
    }

    public ScheduleResult run(ScheduleGraph graph) {
        return run(CompiledSchedule.of(graph));
    }

    /**
     * Runs validate, forward, backward and compile on the schedule.
     *
     * @throws com.planning.cpm.error.CyclicDependencyException   if the graph has a cycle.
     * @throws com.planning.cpm.error.InvariantViolationException on an internal defect.
     * @throws com.planning.cpm.error.TimingOverflowException    if an offset leaves the int range.
     */
    public ScheduleResult run(CompiledSchedule schedule) {
        final ScheduleListener l = this.listener;
        final ScheduleGraph graph = schedule.graph();
        final int n = graph.activityCount();
        log.info("Scheduling {} activities with {} precedence edges", n, graph.edgeCount());

        try {
            long t0 = start(l, Pass.VALIDATE, n);
            TopologicalOrder topology = graph.validate();
            end(l, Pass.VALIDATE, n, t0);
            log.debug("Topological order: {}", topology.ids());

            t0 = start(l, Pass.FORWARD, n);
            EarliestTimes earliest = new ForwardPass(topology).run(l);
            end(l, Pass.FORWARD, n, t0);

            t0 = start(l, Pass.BACKWARD, n);
            LatestTimes latest = new BackwardPass(topology, earliest).run(l);
            end(l, Pass.BACKWARD, n, t0);

            t0 = start(l, Pass.COMPILE, n);
            ScheduleResult result = new ResultCompiler(config).compile(schedule, topology, earliest, latest);
            end(l, Pass.COMPILE, n, t0);

            log.info("Project duration {} days, critical path {}",
                    result.projectDuration(), result.summary().criticalPathLabel());
            return result;
        } catch (ScheduleException e) {
            log.error("Scheduling failed: {}", e.getMessage());
            throw e;
        }
    }

    private static long start(ScheduleListener l, Pass pass, int n) {
        if (l != null)
            l.onPassStart(pass, n);
        return System.nanoTime();
    }

    private static void end(ScheduleListener l, Pass pass, int n, long startNanos) {
        if (l != null)
            l.onPassEnd(pass, n, System.nanoTime() - startNanos);
    }
}
