package com.equipmenthealth.scheduler.error;

/**
 * Lifecycle transition not allowed from the current schedule state.
 */
public class InvalidStateException extends SchedulerException {
    private static final long serialVersionUID = 1L;

    public InvalidStateException(String message, ErrorContext context) {
        super(message, context, null);
    }

    public InvalidStateException(String message, ErrorContext context, Throwable cause) {
        super(message, context, cause);
    }

    @Override
    public String failureClass() {
        return "INVALID_STATE";
    }
}
