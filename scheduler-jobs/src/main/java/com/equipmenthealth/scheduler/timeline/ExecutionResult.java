package com.equipmenthealth.scheduler.timeline;

import com.equipmenthealth.scheduler.model.AnomalyRecord;
import com.equipmenthealth.scheduler.model.ExecutionSummary;

import java.util.List;
import java.util.Objects;

/**
 * Fully parsed records of one successful execution, ready to merge.
 */
public final class ExecutionResult {
    private final ExecutionSummary summary;
    private final List<AnomalyRecord> records;

    public ExecutionResult(ExecutionSummary summary, List<AnomalyRecord> records) {
        this.summary = Objects.requireNonNull(summary, "summary");
        this.records = List.copyOf(records);
    }

    public ExecutionSummary summary() {
        return summary;
    }

    public List<AnomalyRecord> records() {
        return records;
    }
}
