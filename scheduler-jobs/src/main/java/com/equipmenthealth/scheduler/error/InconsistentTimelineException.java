package com.equipmenthealth.scheduler.error;

/**
 * Two executions reported the same timestamp.
 */
public class InconsistentTimelineException extends SchedulerException {
    private static final long serialVersionUID = 1L;

    public InconsistentTimelineException(String message, ErrorContext context) {
        super(message, context, null);
    }

    public InconsistentTimelineException(String message, ErrorContext context, Throwable cause) {
        super(message, context, cause);
    }

    @Override
    public String failureClass() {
        return "INCONSISTENT_TIMELINE";
    }
}
