package com.equipmenthealth.scheduler.error;

/**
 * A remote or storage call could not complete. Only the polling loops retry it.
 */
public class TransportFailureException extends SchedulerException {
    private static final long serialVersionUID = 1L;

    private final String operation;

    public TransportFailureException(String operation, ErrorContext context, Throwable cause) {
        super(operation + " failed: " + describe(cause), context, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }

    @Override
    public String failureClass() {
        return "TRANSPORT_FAILURE";
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() == null || cause.getMessage().isBlank()
                ? cause.getClass().getName()
                : cause.getClass().getName() + ": " + cause.getMessage();
    }
}
