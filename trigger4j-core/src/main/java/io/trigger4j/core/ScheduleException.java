package io.trigger4j.core;

/**
 * Raised when a schedule string cannot be turned into firing times.
 */
public class ScheduleException extends Trigger4jException {

    public enum Reason {
        INVALID_INTERVAL,
        MALFORMED_CRON,
        INVALID_CRON_FIELD
    }

    private final Reason reason;

    public ScheduleException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ScheduleException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
