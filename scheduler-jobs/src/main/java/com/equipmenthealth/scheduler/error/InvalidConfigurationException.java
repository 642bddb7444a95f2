package com.equipmenthealth.scheduler.error;

/**
 * Configuration value outside its allowed set, detected locally or rejected by the remote service.
 */
public class InvalidConfigurationException extends SchedulerException {
    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message, ErrorContext context) {
        super(message, context, null);
    }

    public InvalidConfigurationException(String message, ErrorContext context, Throwable cause) {
        super(message, context, cause);
    }

    @Override
    public String failureClass() {
        return "INVALID_CONFIGURATION";
    }
}
