package com.planning.cpm.error;

/** Raised when an edge would make an activity its own predecessor. */
public final class SelfLoopException extends ScheduleException {
    private final String activityId;

    public SelfLoopException(String activityId) {
        super("Self-edge not allowed: " + activityId);
        this.activityId = activityId;
    }

    public String activityId() {
        return activityId;
    }
}
