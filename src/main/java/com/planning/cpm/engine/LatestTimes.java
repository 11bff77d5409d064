package com.planning.cpm.engine;

/**
 * Output of the backward pass: LS and LF per topological index. Only
 * {@link BackwardPass} creates instances.
 */
public final class LatestTimes {
    private final int[] lateStart;
    private final int[] lateFinish;

    LatestTimes(int[] lateStart, int[] lateFinish) {
        this.lateStart = lateStart;
        this.lateFinish = lateFinish;
    }

    public int lateStart(int ti) {
        return lateStart[ti];
    }

    public int lateFinish(int ti) {
        return lateFinish[ti];
    }

    public int size() {
        return lateStart.length;
    }
}
