package com.equipmenthealth.scheduler.timeline;

import java.time.Duration;
import java.time.Instant;

/**
 * A run of consecutive anomalous records. {@code end} is the timestamp of the last record in the run.
 */
public final class AnomalousEvent {
    public final Instant start;
    public final Instant end;
    public final int recordCount;

    AnomalousEvent(Instant start, Instant end, int recordCount) {
        this.start = start;
        this.end = end;
        this.recordCount = recordCount;
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "AnomalousEvent{" + start + " .. " + end + ", records=" + recordCount + "}";
    }
}
