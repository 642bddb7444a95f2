package com.equipmenthealth.scheduler.polling;

public enum PollOutcome {
    COMPLETED,
    TIMED_OUT,
    CANCELLED
}
