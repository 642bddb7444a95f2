package com.equipmenthealth.scheduler.error;

/**
 * An execution output object could not be parsed into anomaly records.
 */
public class MalformedResultException extends SchedulerException {
    private static final long serialVersionUID = 1L;

    public MalformedResultException(String message, ErrorContext context) {
        super(message, context, null);
    }

    public MalformedResultException(String message, ErrorContext context, Throwable cause) {
        super(message, context, cause);
    }

    @Override
    public String failureClass() {
        return "MALFORMED_RESULT";
    }
}
