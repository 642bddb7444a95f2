package com.equipmenthealth.scheduler.ingestion;

import com.equipmenthealth.scheduler.model.IngestionStatus;

import java.time.Duration;

/**
 * An observed change of an ingestion job's status, stamped with time since the job was started.
 * {@code from} is null for the first observation.
 */
public final class StatusTransition {
    public final String jobId;
    public final IngestionStatus from;
    public final IngestionStatus to;
    public final Duration elapsed;

    StatusTransition(String jobId, IngestionStatus from, IngestionStatus to, Duration elapsed) {
        this.jobId = jobId;
        this.from = from;
        this.to = to;
        this.elapsed = elapsed;
    }

    @Override
    public String toString() {
        return "StatusTransition{jobId=" + jobId + ", " + from + " -> " + to + ", elapsed=" + elapsed + "}";
    }
}
