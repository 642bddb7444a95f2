package com.equipmenthealth.scheduler.model;

import java.util.Objects;

/**
 * Snapshot of a one-shot batch ingestion job.
 */
public final class IngestionJob {
    private final String jobId;
    private final String datasetName;
    private final ObjectRef source;
    private final IngestionStatus status;
    private final String failureReason;

    public IngestionJob(String jobId, String datasetName, ObjectRef source, IngestionStatus status, String failureReason) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.datasetName = datasetName;
        this.source = source;
        this.status = Objects.requireNonNull(status, "status");
        this.failureReason = failureReason;
    }

    public String jobId() {
        return jobId;
    }

    public String datasetName() {
        return datasetName;
    }

    /**
     * Source bucket and prefix; the key of the reference is a prefix, not a single object.
     */
    public ObjectRef source() {
        return source;
    }

    public IngestionStatus status() {
        return status;
    }

    public String failureReason() {
        return failureReason;
    }

    public IngestionJob withStatus(IngestionStatus newStatus, String reason) {
        return new IngestionJob(jobId, datasetName, source, newStatus, reason);
    }

    @Override
    public String toString() {
        return "IngestionJob{jobId=" + jobId + ", dataset=" + datasetName + ", status=" + status + "}";
    }
}
