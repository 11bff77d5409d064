package com.planning.cpm.error;

/**
 * Internal defect: two derivations of the same quantity disagree. Never caused
 * by user input.
 */
public final class InvariantViolationException extends ScheduleException {
    private final String activityId;

    public InvariantViolationException(String activityId, String message) {
        super("Invariant violated for activity " + activityId + ": " + message);
        this.activityId = activityId;
    }

    public String activityId() {
        return activityId;
    }
}
