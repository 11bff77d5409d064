package com.planning.cpm.engine;

import com.planning.cpm.api.Activity;
import com.planning.cpm.api.ScheduleListener;
import com.planning.cpm.error.TimingOverflowException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes latest start and finish for every activity.
 *
 * <p>
 * Mirror of {@link ForwardPass}: activities are visited in reverse topological
 * order. LF starts at the project duration and is lowered by every outgoing
 * edge contribution, so no activity finishes later than the project end.
 */
public final class BackwardPass {
    private static final Logger log = LogManager.getLogger(BackwardPass.class);

    private final TopologicalOrder topology;
    private final EarliestTimes earliest;

    public BackwardPass(TopologicalOrder topology, EarliestTimes earliest) {
        if (earliest.size() != topology.activityCount())
            throw new IllegalArgumentException("Forward pass results do not match the topology: "
                    + earliest.size() + " vs " + topology.activityCount());
        this.topology = topology;
        this.earliest = earliest;
    }

    public LatestTimes run() {
        return run(null);
    }

    /**
     * @param listener Optional, may be null.
     */
    public LatestTimes run(ScheduleListener listener) {
        final int n = topology.activityCount();
        final int projectDuration = earliest.projectDuration();
        int[] ls = new int[n];
        int[] lf = new int[n];

        for (int ti = n - 1; ti >= 0; ti--) {
            Activity activity = topology.activity(ti);
            int finish = projectDuration;

            try {
                final int end = topology.childrenEnd(ti);
                for (int ci = topology.childrenStart(ti); ci < end; ci++) {
                    int succ = topology.childAt(ci);
                    int contribution = topology.childTypeAt(ci)
                            .latestFinish(earliest.earlyStart(succ), ls[succ], lf[succ], topology.childLagAt(ci));
                    if (contribution < finish)
                        finish = contribution;
                }
                ls[ti] = Math.subtractExact(finish, activity.duration());
            } catch (ArithmeticException e) {
                throw new TimingOverflowException(activity.id(), e);
            }
            lf[ti] = finish;

            if (listener != null)
                listener.onActivityTimed(ScheduleListener.Pass.BACKWARD, ti, activity.id(), ls[ti], lf[ti]);
        }

        log.debug("Backward pass over {} activities from boundary {}", n, projectDuration);
        return new LatestTimes(ls, lf);
    }
}
