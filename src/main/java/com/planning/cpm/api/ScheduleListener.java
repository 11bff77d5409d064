package com.planning.cpm.api;

/**
 * Observability hook for a scheduling run.
 *
 * <p>
 * Callbacks run synchronously on the calling thread, once per pass and once
 * per activity within a pass. Implementations must not throw.
 */
public interface ScheduleListener {

    /** The passes of one scheduling run, in execution order. */
    enum Pass {
        VALIDATE, FORWARD, BACKWARD, COMPILE
    }

    /**
     * Called immediately before a pass begins.
     *
     * @param pass          The pass about to run.
     * @param activityCount Number of activities in the graph.
     */
    void onPassStart(Pass pass, int activityCount);

    /**
     * Called once an activity's values for the current pass are final.
     *
     * @param pass       FORWARD or BACKWARD.
     * @param topoIndex  Topological index of the activity.
     * @param activityId Activity id.
     * @param start      ES for the forward pass, LS for the backward pass.
     * @param finish     EF for the forward pass, LF for the backward pass.
     */
    void onActivityTimed(Pass pass, int topoIndex, String activityId, int start, int finish);

    /**
     * Called after a pass completes successfully.
     *
     * @param pass           The pass that finished.
     * @param activityCount  Number of activities processed.
     * @param durationNanos  Wall time of the pass.
     */
    void onPassEnd(Pass pass, int activityCount, long durationNanos);
}
