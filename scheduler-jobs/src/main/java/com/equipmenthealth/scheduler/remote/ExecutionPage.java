package com.equipmenthealth.scheduler.remote;

import com.equipmenthealth.scheduler.model.ExecutionSummary;

import java.util.List;

/**
 * One page of ListExecutions results; {@code nextToken} is null on the last page.
 */
public final class ExecutionPage {
    public final List<ExecutionSummary> items;
    public final String nextToken;

    public ExecutionPage(List<ExecutionSummary> items, String nextToken) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.nextToken = nextToken;
    }
}
