package com.planning.cpm.engine;

import com.planning.cpm.api.Activity;
import com.planning.cpm.api.ScheduleListener;
import com.planning.cpm.error.TimingOverflowException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes earliest start and finish for every activity.
 *
 * <p>
 * Activities are visited strictly in topological order, so all predecessors of
 * an activity are final when it is reached. ES is the max-reduction of the
 * incoming edge contributions (see {@link com.planning.cpm.api.RelationType});
 * an activity without predecessors starts at 0. ES is not floored at 0 when
 * predecessors exist: every contribution being negative yields a negative ES,
 * which is a valid offset from an arbitrary origin. An offset outside the int
 * range fails with {@link TimingOverflowException}.
 */
public final class ForwardPass {
    private static final Logger log = LogManager.getLogger(ForwardPass.class);

    private final TopologicalOrder topology;

    public ForwardPass(TopologicalOrder topology) {
        this.topology = topology;
    }

    public EarliestTimes run() {
        return run(null);
    }

    /**
     * @param listener Optional, may be null.
     */
    public EarliestTimes run(ScheduleListener listener) {
        final int n = topology.activityCount();
        int[] es = new int[n];
        int[] ef = new int[n];
        int projectDuration = n == 0 ? 0 : Integer.MIN_VALUE;

        for (int ti = 0; ti < n; ti++) {
            Activity activity = topology.activity(ti);
            int d = activity.duration();
            int start = topology.parentCount(ti) == 0 ? 0 : Integer.MIN_VALUE;

            try {
                final int end = topology.parentsEnd(ti);
                for (int pi = topology.parentsStart(ti); pi < end; pi++) {
                    int pred = topology.parentAt(pi);
                    int contribution = topology.parentTypeAt(pi)
                            .earliestStart(es[pred], ef[pred], topology.parentLagAt(pi), d);
                    if (contribution > start)
                        start = contribution;
                }
                ef[ti] = Math.addExact(start, d);
            } catch (ArithmeticException e) {
                throw new TimingOverflowException(activity.id(), e);
            }
            es[ti] = start;
            if (ef[ti] > projectDuration)
                projectDuration = ef[ti];

            if (listener != null)
                listener.onActivityTimed(ScheduleListener.Pass.FORWARD, ti, activity.id(), es[ti], ef[ti]);
        }

        log.debug("Forward pass over {} activities, project duration {}", n, projectDuration);
        return new EarliestTimes(es, ef, projectDuration);
    }
}
