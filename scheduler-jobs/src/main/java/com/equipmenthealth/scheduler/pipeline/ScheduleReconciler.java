package com.equipmenthealth.scheduler.pipeline;

import com.equipmenthealth.scheduler.execution.ExecutionLedger;
import com.equipmenthealth.scheduler.execution.ExecutionPoller;
import com.equipmenthealth.scheduler.execution.ExecutionQuery;
import com.equipmenthealth.scheduler.model.ExecutionStatus;
import com.equipmenthealth.scheduler.model.ExecutionSummary;
import com.equipmenthealth.scheduler.polling.CancellationToken;
import com.equipmenthealth.scheduler.polling.PollResult;
import com.equipmenthealth.scheduler.timeline.AggregationReport;
import com.equipmenthealth.scheduler.timeline.ResultAggregator;
import com.equipmenthealth.scheduler.timeline.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Control loop step for one schedule: refresh the execution ledger, then merge every successful
 * execution the timeline does not hold yet.
 *
 * <p>Executions rejected by an earlier pass stay in the ledger unmerged and are offered to the
 * aggregator again on the next pass. FAILED executions are reported only the pass they first appear in.</p>
 */
public class ScheduleReconciler {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleReconciler.class);

    private final ExecutionPoller poller;
    private final ResultAggregator aggregator;
    private final ExecutionLedger ledger;
    private final Timeline timeline;

    public ScheduleReconciler(ExecutionPoller poller, ResultAggregator aggregator, ExecutionLedger ledger, Timeline timeline) {
        this.poller = Objects.requireNonNull(poller, "poller");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.timeline = Objects.requireNonNull(timeline, "timeline");
        if (!ledger.scheduleName().equals(timeline.scheduleName())) {
            throw new IllegalArgumentException("Ledger and timeline belong to different schedules");
        }
    }

    public Timeline timeline() {
        return timeline;
    }

    public ExecutionLedger ledger() {
        return ledger;
    }

    public AggregationReport reconcile(ExecutionQuery query) {
        List<ExecutionSummary> changed = poller.refresh(ledger, query);
        List<ExecutionSummary> candidates = new ArrayList<>();
        for (ExecutionSummary summary : ledger.withStatus(ExecutionStatus.SUCCESS)) {
            if (!timeline.isMerged(summary.fireTime())) {
                candidates.add(summary);
            }
        }
        for (ExecutionSummary summary : changed) {
            if (summary.status() != ExecutionStatus.SUCCESS) {
                candidates.add(summary);
            }
        }
        return aggregator.aggregate(timeline, candidates);
    }

    /**
     * Waits for the schedule's first execution, then reconciles. Returns null when the wait timed
     * out or was cancelled.
     */
    public AggregationReport awaitAndReconcile(ExecutionQuery query, Duration maxWait, CancellationToken token) {
        PollResult<List<ExecutionSummary>> first = poller.awaitFirstResult(query, maxWait, token);
        if (!first.isCompleted()) {
            LOG.warn("No execution of {} observed: {}", query.scheduleName, first.outcome);
            return null;
        }
        return reconcile(query);
    }
}
