package com.equipmenthealth.scheduler.error;

/**
 * A schedule already exists for the model.
 */
public class AlreadyExistsException extends SchedulerException {
    private static final long serialVersionUID = 1L;

    public AlreadyExistsException(String message, ErrorContext context) {
        super(message, context, null);
    }

    public AlreadyExistsException(String message, ErrorContext context, Throwable cause) {
        super(message, context, cause);
    }

    @Override
    public String failureClass() {
        return "ALREADY_EXISTS";
    }
}
