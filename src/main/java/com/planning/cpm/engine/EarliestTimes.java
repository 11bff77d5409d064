package com.planning.cpm.engine;

/**
 * Output of the forward pass: ES and EF per topological index, and the
 * project duration. Only {@link ForwardPass} creates instances.
 */
public final class EarliestTimes {
    private final int[] earlyStart;
    private final int[] earlyFinish;
    private final int projectDuration;

    EarliestTimes(int[] earlyStart, int[] earlyFinish, int projectDuration) {
        this.earlyStart = earlyStart;
        this.earlyFinish = earlyFinish;
        this.projectDuration = projectDuration;
    }

    public int earlyStart(int ti) {
        return earlyStart[ti];
    }

    public int earlyFinish(int ti) {
        return earlyFinish[ti];
    }

    /** Maximum EF over all activities; 0 for an empty schedule. */
    public int projectDuration() {
        return projectDuration;
    }

    public int size() {
        return earlyStart.length;
    }
}
