package com.equipmenthealth.scheduler.error;

/**
 * Root of the scheduler's failure taxonomy. The message always carries the {@link ErrorContext}.
 */
public abstract class SchedulerException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient ErrorContext context;

    protected SchedulerException(String message, ErrorContext context, Throwable cause) {
        super(render(message, context), cause);
        this.context = context == null ? ErrorContext.NONE : context;
    }

    public ErrorContext context() {
        return context;
    }

    /**
     * Stable failure class used in logs and pass reports.
     */
    public abstract String failureClass();

    private static String render(String message, ErrorContext context) {
        if (context == null || context.isEmpty()) {
            return message;
        }
        return message + " [" + context + "]";
    }
}
