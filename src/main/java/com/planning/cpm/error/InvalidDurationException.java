package com.planning.cpm.error;

/** Raised when an activity is declared with a negative duration. */
public final class InvalidDurationException extends ScheduleException {
    private final String activityId;
    private final int duration;

    public InvalidDurationException(String activityId, int duration) {
        super("Activity " + activityId + " has negative duration " + duration);
        this.activityId = activityId;
        this.duration = duration;
    }

    public String activityId() {
        return activityId;
    }

    public int duration() {
        return duration;
    }
}
