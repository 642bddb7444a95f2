package com.equipmenthealth.scheduler.execution;

import com.equipmenthealth.scheduler.model.ExecutionStatus;
import com.equipmenthealth.scheduler.model.ExecutionSummary;
import com.equipmenthealth.scheduler.model.TimeRange;

import java.util.Objects;

/**
 * Filters for listing a schedule's executions. A null range or status matches everything.
 */
public final class ExecutionQuery {
    public final String scheduleName;
    public final TimeRange fireTimeRange;
    public final ExecutionStatus statusFilter;

    private ExecutionQuery(String scheduleName, TimeRange fireTimeRange, ExecutionStatus statusFilter) {
        this.scheduleName = Objects.requireNonNull(scheduleName, "scheduleName");
        this.fireTimeRange = fireTimeRange;
        this.statusFilter = statusFilter;
    }

    public static ExecutionQuery all(String scheduleName) {
        return new ExecutionQuery(scheduleName, null, null);
    }

    public ExecutionQuery within(TimeRange range) {
        return new ExecutionQuery(scheduleName, range, statusFilter);
    }

    public ExecutionQuery withStatus(ExecutionStatus status) {
        return new ExecutionQuery(scheduleName, fireTimeRange, status);
    }

    public boolean accepts(ExecutionSummary summary) {
        if (!scheduleName.equals(summary.scheduleName())) {
            return false;
        }
        if (statusFilter != null && summary.status() != statusFilter) {
            return false;
        }
        return fireTimeRange == null || fireTimeRange.contains(summary.fireTime());
    }

    @Override
    public String toString() {
        return "ExecutionQuery{schedule=" + scheduleName + ", range=" + fireTimeRange + ", status=" + statusFilter + "}";
    }
}
