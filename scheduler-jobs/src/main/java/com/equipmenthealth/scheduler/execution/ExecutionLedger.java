package com.equipmenthealth.scheduler.execution;

import com.equipmenthealth.scheduler.model.ExecutionStatus;
import com.equipmenthealth.scheduler.model.ExecutionSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Accumulated view of one schedule's executions, keyed by fire time.
 *
 * <p>Callers own the ledger and pass it to {@link ExecutionPoller#refresh}; nothing about it is
 * process-wide. A summary replaces the one at the same fire time only when it differs, which is
 * how IN_PROGRESS executions later show up as SUCCESS or FAILED.</p>
 */
public final class ExecutionLedger {
    private final String scheduleName;
    private final TreeMap<Instant, ExecutionSummary> byFireTime = new TreeMap<>();

    public ExecutionLedger(String scheduleName) {
        this.scheduleName = Objects.requireNonNull(scheduleName, "scheduleName");
    }

    public String scheduleName() {
        return scheduleName;
    }

    /**
     * Records the summaries and returns those that were new or changed, in fire-time order. A batch
     * holding another schedule's execution is refused whole.
     */
    public synchronized List<ExecutionSummary> record(Collection<ExecutionSummary> summaries) {
        for (ExecutionSummary summary : summaries) {
            if (!scheduleName.equals(summary.scheduleName())) {
                throw new IllegalArgumentException(
                        "Ledger for " + scheduleName + " cannot record execution of " + summary.scheduleName());
            }
        }
        TreeMap<Instant, ExecutionSummary> changed = new TreeMap<>();
        for (ExecutionSummary summary : summaries) {
            ExecutionSummary previous = byFireTime.put(summary.fireTime(), summary);
            if (!summary.equals(previous)) {
                changed.put(summary.fireTime(), summary);
            }
        }
        return new ArrayList<>(changed.values());
    }

    public synchronized List<ExecutionSummary> all() {
        return new ArrayList<>(byFireTime.values());
    }

    public synchronized List<ExecutionSummary> withStatus(ExecutionStatus status) {
        List<ExecutionSummary> out = new ArrayList<>();
        for (ExecutionSummary summary : byFireTime.values()) {
            if (summary.status() == status) {
                out.add(summary);
            }
        }
        return out;
    }

    public synchronized Optional<ExecutionSummary> get(Instant fireTime) {
        return Optional.ofNullable(byFireTime.get(fireTime));
    }

    public synchronized int size() {
        return byFireTime.size();
    }
}
