package com.equipmenthealth.scheduler.polling;

import com.equipmenthealth.scheduler.error.TransportFailureException;

import java.time.Duration;

/**
 * How a bounded polling loop ended, with the last value it observed.
 */
public final class PollResult<T> {
    public final PollOutcome outcome;
    public final T lastValue;
    public final int attempts;
    public final Duration elapsed;
    public final TransportFailureException lastTransportFailure;

    PollResult(PollOutcome outcome, T lastValue, int attempts, Duration elapsed, TransportFailureException lastTransportFailure) {
        this.outcome = outcome;
        this.lastValue = lastValue;
        this.attempts = attempts;
        this.elapsed = elapsed;
        this.lastTransportFailure = lastTransportFailure;
    }

    public boolean isCompleted() {
        return outcome == PollOutcome.COMPLETED;
    }

    @Override
    public String toString() {
        return "PollResult{outcome=" + outcome + ", attempts=" + attempts + ", elapsed=" + elapsed + "}";
    }
}
