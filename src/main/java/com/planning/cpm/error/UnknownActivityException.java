package com.planning.cpm.error;

/**
 * Raised when a precedence edge names an activity that was never declared.
 * Such edges are never silently dropped.
 */
public final class UnknownActivityException extends ScheduleException {
    private final String activityId;
    private final String predecessorId;
    private final String successorId;

    public UnknownActivityException(String activityId, String predecessorId, String successorId) {
        super("Unknown activity '" + activityId + "' in edge " + predecessorId + " -> " + successorId);
        this.activityId = activityId;
        this.predecessorId = predecessorId;
        this.successorId = successorId;
    }

    /** The id that could not be resolved. */
    public String activityId() {
        return activityId;
    }

    public String predecessorId() {
        return predecessorId;
    }

    public String successorId() {
        return successorId;
    }
}
