package com.equipmenthealth.scheduler.remote;

import com.equipmenthealth.scheduler.model.ExecutionStatus;
import com.equipmenthealth.scheduler.model.TimeRange;

/**
 * One page request against ListExecutions. Null range and status mean "no filter".
 */
public final class ListExecutionsRequest {
    public final String scheduleName;
    public final TimeRange fireTimeRange;
    public final ExecutionStatus statusFilter;
    public final int pageSize;
    public final String nextToken;

    public ListExecutionsRequest(
            String scheduleName, TimeRange fireTimeRange, ExecutionStatus statusFilter, int pageSize, String nextToken) {
        this.scheduleName = scheduleName;
        this.fireTimeRange = fireTimeRange;
        this.statusFilter = statusFilter;
        this.pageSize = pageSize;
        this.nextToken = nextToken;
    }

    public ListExecutionsRequest withNextToken(String token) {
        return new ListExecutionsRequest(scheduleName, fireTimeRange, statusFilter, pageSize, token);
    }
}
