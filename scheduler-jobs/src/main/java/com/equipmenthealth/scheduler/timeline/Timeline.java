package com.equipmenthealth.scheduler.timeline;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.InconsistentTimelineException;
import com.equipmenthealth.scheduler.model.AnomalyRecord;
import com.equipmenthealth.scheduler.model.ExecutionSummary;
import com.equipmenthealth.scheduler.model.TimeRange;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Time-ordered anomaly records of one schedule, merged from its executions.
 *
 * <p>Invariants:
 * - Keys are unique; a timestamp reported by two executions is an {@link InconsistentTimelineException}
 *   and never overwrites the existing record.
 * - Merges are all-or-nothing: a rejected merge leaves the timeline exactly as it was.
 * - Records are only ever added. Each execution is merged at most once.
 * </p>
 *
 * <p>Single writer, many readers: merges take the write lock, every read takes the read lock and
 * returns a copy.</p>
 */
public final class Timeline {
    private final String scheduleName;
    private final TreeMap<Instant, AnomalyRecord> records = new TreeMap<>();
    private final Map<Instant, Instant> sourceFireTime = new HashMap<>();
    private final TreeSet<Instant> mergedExecutions = new TreeSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Timeline(String scheduleName) {
        this.scheduleName = Objects.requireNonNull(scheduleName, "scheduleName");
    }

    public String scheduleName() {
        return scheduleName;
    }

    /**
     * Adds one execution's records.
     *
     * @return the number of records added; 0 when the execution was already merged
     * @throws InconsistentTimelineException when a timestamp is already present
     */
    public int merge(ExecutionResult result) {
        return mergeAll(List.of(result));
    }

    /**
     * Adds several executions' records atomically: either every record is added or, on any
     * collision (with existing records or between the given executions), none is.
     */
    public int mergeAll(List<ExecutionResult> results) {
        lock.writeLock().lock();
        try {
            Map<Instant, ExecutionSummary> pending = new HashMap<>();
            List<ExecutionResult> fresh = new ArrayList<>();
            for (ExecutionResult result : results) {
                ExecutionSummary summary = result.summary();
                requireSameSchedule(summary);
                if (mergedExecutions.contains(summary.fireTime())) {
                    continue;
                }
                for (AnomalyRecord record : result.records()) {
                    Instant ts = record.timestamp();
                    Instant owner = sourceFireTime.get(ts);
                    ExecutionSummary pendingOwner = pending.putIfAbsent(ts, summary);
                    if (owner == null && pendingOwner != null) {
                        owner = pendingOwner.fireTime();
                    }
                    if (owner != null) {
                        throw new InconsistentTimelineException(
                                "Timestamp " + ts + " already reported by execution fired at " + owner,
                                contextOf(summary));
                    }
                }
                fresh.add(result);
            }

            int added = 0;
            for (ExecutionResult result : fresh) {
                Instant fireTime = result.summary().fireTime();
                for (AnomalyRecord record : result.records()) {
                    records.put(record.timestamp(), record);
                    sourceFireTime.put(record.timestamp(), fireTime);
                    added++;
                }
                mergedExecutions.add(fireTime);
            }
            return added;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isMerged(Instant fireTime) {
        lock.readLock().lock();
        try {
            return mergedExecutions.contains(fireTime);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Instant> mergedExecutions() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(mergedExecutions);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Optional<AnomalyRecord> get(Instant timestamp) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(timestamp));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All records in ascending timestamp order.
     */
    public List<AnomalyRecord> records() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(records.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AnomalyRecord> between(TimeRange range) {
        lock.readLock().lock();
        try {
            return new ArrayList<>(records.subMap(range.start(), true, range.end(), false).values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AnomalyRecord> anomalies() {
        List<AnomalyRecord> out = new ArrayList<>();
        for (AnomalyRecord record : records()) {
            if (record.isAnomaly()) {
                out.add(record);
            }
        }
        return out;
    }

    public List<AnomalousEvent> anomalousEvents(Duration maxGap) {
        return AnomalousEventDetector.detect(records(), maxGap);
    }

    private void requireSameSchedule(ExecutionSummary summary) {
        if (!scheduleName.equals(summary.scheduleName())) {
            throw new IllegalArgumentException(
                    "Timeline of " + scheduleName + " cannot merge execution of " + summary.scheduleName());
        }
    }

    private static ErrorContext contextOf(ExecutionSummary summary) {
        return ErrorContext.execution(
                summary.scheduleName(),
                summary.fireTime(),
                summary.output() == null ? null : summary.output().key());
    }
}
