package com.planning.cpm.util;

import com.planning.cpm.api.ScheduleListener;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tracks wall time per pass across scheduling runs.
 *
 * <p>
 * Captures, for each {@link ScheduleListener.Pass}: number of runs, last,
 * min, max and total latency in nanoseconds.
 */
public final class PassLatencyListener implements ScheduleListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(PassLatencyListener.class);

    private final Map<Pass, PassStats> stats = new EnumMap<>(Pass.class);

    public static final class PassStats {
        private long count;
        private long totalNanos;
        private long lastNanos;
        private long minNanos = Long.MAX_VALUE;
        private long maxNanos = Long.MIN_VALUE;

        void update(long nanos) {
            count++;
            totalNanos += nanos;
            lastNanos = nanos;
            if (nanos < minNanos)
                minNanos = nanos;
            if (nanos > maxNanos)
                maxNanos = nanos;
        }

        public long count() {
            return count;
        }

        public long lastNanos() {
            return lastNanos;
        }

        public long minNanos() {
            return count == 0 ? 0 : minNanos;
        }

        public long maxNanos() {
            return count == 0 ? 0 : maxNanos;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalNanos / (double) count / 1000.0;
        }
    }

    @Override
    public void onPassStart(Pass pass, int activityCount) {
        // No-op
    }

    @Override
    public void onActivityTimed(Pass pass, int topoIndex, String activityId, int start, int finish) {
        // No-op to keep per-activity overhead minimal
    }

    @Override
    public void onPassEnd(Pass pass, int activityCount, long durationNanos) {
        stats.computeIfAbsent(pass, p -> new PassStats()).update(durationNanos);
        log.trace("{} pass over {} activities took {} ns", pass, activityCount, durationNanos);
    }

    /** @return statistics for the pass, or null if it never completed. */
    public PassStats stats(Pass pass) {
        return stats.get(pass);
    }

    /** Number of completed scheduling runs, counted by finished compile passes. */
    public long runCount() {
        PassStats compile = stats.get(Pass.COMPILE);
        return compile == null ? 0 : compile.count();
    }

    public String report() {
        StringBuilder sb = new StringBuilder(256);
        for (Pass pass : Pass.values()) {
            PassStats s = stats.get(pass);
            if (s == null)
                continue;
            sb.append(String.format("%-8s runs=%d avg=%.2fus min=%dns max=%dns%n",
                    pass, s.count(), s.avgMicros(), s.minNanos(), s.maxNanos()));
        }
        return sb.toString();
    }
}
