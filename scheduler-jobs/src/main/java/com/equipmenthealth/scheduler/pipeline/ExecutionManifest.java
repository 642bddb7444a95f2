package com.equipmenthealth.scheduler.pipeline;

import com.equipmenthealth.scheduler.model.ExecutionSummary;

import java.util.List;

/**
 * Executions of one schedule exported for offline reconciliation.
 */
public final class ExecutionManifest {
    public final String scheduleName;
    public final List<ExecutionSummary> executions;

    ExecutionManifest(String scheduleName, List<ExecutionSummary> executions) {
        this.scheduleName = scheduleName;
        this.executions = List.copyOf(executions);
    }
}
