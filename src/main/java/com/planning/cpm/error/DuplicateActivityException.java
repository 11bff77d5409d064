package com.planning.cpm.error;

/** Raised when an activity id is inserted twice. */
public final class DuplicateActivityException extends ScheduleException {
    private final String activityId;

    public DuplicateActivityException(String activityId) {
        super("Duplicate activity id: " + activityId);
        this.activityId = activityId;
    }

    public String activityId() {
        return activityId;
    }
}
