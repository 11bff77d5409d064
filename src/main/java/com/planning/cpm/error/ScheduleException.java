package com.planning.cpm.error;

/**
 * Base type of every failure raised while building, validating or computing a
 * schedule.
 *
 * <p>
 * All subclasses are unchecked. Construction and validation failures stop the
 * pipeline: no partial schedule is ever produced once one of these is thrown.
 */
public abstract class ScheduleException extends RuntimeException {

    protected ScheduleException(String message) {
        super(message);
    }

    protected ScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
