package com.planning.cpm.error;

/**
 * Raised at ingestion when an input row or document does not fit the record
 * schema (blank id, unreadable date, malformed document).
 */
public final class InvalidRecordException extends ScheduleException {
    private final int row;
    private final String field;

    public InvalidRecordException(int row, String field, String message) {
        super("Row " + row + ", field " + field + ": " + message);
        this.row = row;
        this.field = field;
    }

    public InvalidRecordException(int row, String field, String message, Throwable cause) {
        super("Row " + row + ", field " + field + ": " + message, cause);
        this.row = row;
        this.field = field;
    }

    public InvalidRecordException(String message, Throwable cause) {
        super(message, cause);
        this.row = -1;
        this.field = null;
    }

    /** Zero-based row index, or -1 when the whole document is unreadable. */
    public int row() {
        return row;
    }

    public String field() {
        return field;
    }
}
