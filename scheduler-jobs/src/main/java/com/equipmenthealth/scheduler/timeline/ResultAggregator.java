package com.equipmenthealth.scheduler.timeline;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.SchedulerException;
import com.equipmenthealth.scheduler.error.TransportFailureException;
import com.equipmenthealth.scheduler.model.AnomalyRecord;
import com.equipmenthealth.scheduler.model.ExecutionStatus;
import com.equipmenthealth.scheduler.model.ExecutionSummary;
import com.equipmenthealth.scheduler.parse.AnomalyResultParser;
import com.equipmenthealth.scheduler.remote.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Turns successful executions into timeline records.
 *
 * <p>Fetch and parse run concurrently on a bounded pool; merging is done by the calling thread
 * one execution at a time in fire-time order. A malformed artifact, an inconsistent timestamp or
 * a failed fetch rejects only that execution's contribution; it is reported and left unmerged so a
 * later pass can pick it up again.</p>
 */
public class ResultAggregator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ResultAggregator.class);

    private final ObjectStore store;
    private final AnomalyResultParser parser;
    private final ExecutorService executor;

    public ResultAggregator(ObjectStore store, int parallelism) {
        this.store = store;
        this.parser = new AnomalyResultParser();
        this.executor = Executors.newFixedThreadPool(Math.max(1, parallelism), runnable -> {
            Thread thread = new Thread(runnable, "result-aggregator");
            thread.setDaemon(true);
            return thread;
        });
    }

    public AggregationReport aggregate(Timeline timeline, Collection<ExecutionSummary> executions) {
        List<ExecutionSummary> ordered = new ArrayList<>(executions);
        ordered.sort(Comparator.comparing(ExecutionSummary::fireTime));

        Map<Instant, ExecutionSummary> toFetch = new LinkedHashMap<>();
        List<ExecutionSummary> remoteFailed = new ArrayList<>();
        int inProgress = 0;
        int alreadyMerged = 0;
        for (ExecutionSummary summary : ordered) {
            if (!timeline.scheduleName().equals(summary.scheduleName())) {
                throw new IllegalArgumentException(
                        "Timeline of " + timeline.scheduleName() + " cannot aggregate " + summary);
            }
            if (summary.status() == ExecutionStatus.FAILED) {
                remoteFailed.add(summary);
            } else if (summary.status() == ExecutionStatus.IN_PROGRESS) {
                inProgress++;
            } else if (timeline.isMerged(summary.fireTime()) || toFetch.containsKey(summary.fireTime())) {
                alreadyMerged++;
            } else {
                toFetch.put(summary.fireTime(), summary);
            }
        }

        Map<ExecutionSummary, CompletableFuture<ExecutionResult>> pending = new LinkedHashMap<>();
        for (ExecutionSummary summary : toFetch.values()) {
            pending.put(summary, CompletableFuture.supplyAsync(() -> fetch(summary), executor));
        }

        List<Instant> merged = new ArrayList<>();
        List<ExecutionFailure> rejected = new ArrayList<>();
        int recordsAdded = 0;
        for (Map.Entry<ExecutionSummary, CompletableFuture<ExecutionResult>> entry : pending.entrySet()) {
            ExecutionSummary summary = entry.getKey();
            try {
                ExecutionResult result = join(summary, entry.getValue());
                recordsAdded += timeline.merge(result);
                merged.add(summary.fireTime());
            } catch (SchedulerException ex) {
                LOG.warn("Execution {} of {} not merged: {}", summary.fireTime(), summary.scheduleName(), ex.getMessage());
                rejected.add(new ExecutionFailure(summary, ex));
            }
        }

        for (ExecutionSummary failed : remoteFailed) {
            LOG.warn("Execution {} of {} failed remotely: {}", failed.fireTime(), failed.scheduleName(),
                    failed.failureReason() == null ? "no reason reported" : failed.failureReason());
        }
        AggregationReport report = new AggregationReport(
                merged, recordsAdded, remoteFailed, inProgress, alreadyMerged, rejected);
        LOG.info("Aggregation pass for {}: {} (timeline size {})", timeline.scheduleName(), report, timeline.size());
        return report;
    }

    private ExecutionResult fetch(ExecutionSummary summary) {
        ErrorContext context = ErrorContext.execution(
                summary.scheduleName(), summary.fireTime(), summary.output().key());
        List<AnomalyRecord> records;
        try (InputStream in = store.getObject(summary.output())) {
            records = parser.parse(in, context);
        } catch (IOException ex) {
            throw new TransportFailureException("GetObject", context, ex);
        } catch (SchedulerException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            // Stores outside the error taxonomy still fail only this execution.
            throw new TransportFailureException("GetObject", context, ex);
        }
        LOG.debug("Parsed {} records from {}", records.size(), summary.output());
        return new ExecutionResult(summary, records);
    }

    private static ExecutionResult join(ExecutionSummary summary, CompletableFuture<ExecutionResult> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof SchedulerException) {
                throw (SchedulerException) ex.getCause();
            }
            throw new TransportFailureException("GetObject", ErrorContext.execution(
                    summary.scheduleName(), summary.fireTime(), summary.output().key()), ex.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
