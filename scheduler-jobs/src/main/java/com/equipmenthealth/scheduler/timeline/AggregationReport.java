package com.equipmenthealth.scheduler.timeline;

import com.equipmenthealth.scheduler.model.ExecutionSummary;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one aggregation pass. Remote-reported FAILED executions are listed for operators;
 * {@link #rejected} holds executions whose output could not be merged.
 */
public final class AggregationReport {
    public final List<Instant> merged;
    public final int recordsAdded;
    public final List<ExecutionSummary> remoteFailed;
    public final int inProgressSkipped;
    public final int alreadyMerged;
    public final List<ExecutionFailure> rejected;

    AggregationReport(
            List<Instant> merged,
            int recordsAdded,
            List<ExecutionSummary> remoteFailed,
            int inProgressSkipped,
            int alreadyMerged,
            List<ExecutionFailure> rejected) {
        this.merged = List.copyOf(merged);
        this.recordsAdded = recordsAdded;
        this.remoteFailed = List.copyOf(remoteFailed);
        this.inProgressSkipped = inProgressSkipped;
        this.alreadyMerged = alreadyMerged;
        this.rejected = List.copyOf(rejected);
    }

    public boolean isClean() {
        return rejected.isEmpty();
    }

    @Override
    public String toString() {
        return "AggregationReport{merged=" + merged.size()
                + ", recordsAdded=" + recordsAdded
                + ", remoteFailed=" + remoteFailed.size()
                + ", inProgressSkipped=" + inProgressSkipped
                + ", alreadyMerged=" + alreadyMerged
                + ", rejected=" + rejected.size() + "}";
    }
}
