package com.equipmenthealth.scheduler.timeline;

import com.equipmenthealth.scheduler.error.SchedulerException;
import com.equipmenthealth.scheduler.model.ExecutionSummary;

/**
 * An execution whose contribution was rejected during an aggregation pass.
 */
public final class ExecutionFailure {
    public final ExecutionSummary execution;
    public final String failureClass;
    public final String details;

    ExecutionFailure(ExecutionSummary execution, SchedulerException cause) {
        this.execution = execution;
        this.failureClass = cause.failureClass();
        this.details = cause.getMessage();
    }

    @Override
    public String toString() {
        return failureClass + " " + execution.fireTime() + ": " + details;
    }
}
