package com.planning.cpm.error;

/**
 * A timing offset of an activity does not fit in an int day count, usually
 * because of very large lags accumulating along a chain.
 */
public final class TimingOverflowException extends ScheduleException {
    private final String activityId;

    public TimingOverflowException(String activityId, ArithmeticException cause) {
        super("Timing of activity " + activityId + " overflows the day range", cause);
        this.activityId = activityId;
    }

    public String activityId() {
        return activityId;
    }
}
