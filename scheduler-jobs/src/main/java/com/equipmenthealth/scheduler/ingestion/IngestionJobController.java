package com.equipmenthealth.scheduler.ingestion;

import com.equipmenthealth.scheduler.model.IngestionJob;
import com.equipmenthealth.scheduler.model.IngestionStatus;
import com.equipmenthealth.scheduler.model.ObjectRef;
import com.equipmenthealth.scheduler.polling.CancellationToken;
import com.equipmenthealth.scheduler.polling.PollResult;
import com.equipmenthealth.scheduler.polling.PollingLoop;
import com.equipmenthealth.scheduler.remote.InferenceService;
import com.equipmenthealth.scheduler.util.StringSemantics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs a one-shot ingestion job to a terminal status.
 *
 * <p>A FAILED job is returned as data in the poll result, never resubmitted.</p>
 */
public class IngestionJobController {
    private static final Logger LOG = LoggerFactory.getLogger(IngestionJobController.class);

    private final InferenceService service;
    private final PollingLoop loop;
    private final Duration pollInterval;
    private final Duration maxWait;

    public IngestionJobController(InferenceService service, PollingLoop loop, Duration pollInterval, Duration maxWait) {
        this.service = Objects.requireNonNull(service, "service");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.maxWait = Objects.requireNonNull(maxWait, "maxWait");
    }

    public IngestionJob start(String datasetName, String roleArn, ObjectRef source) {
        if (StringSemantics.isBlank(datasetName)) {
            throw new IllegalArgumentException("Dataset name must not be blank");
        }
        Objects.requireNonNull(source, "source");
        IngestionJob job = service.startIngestionJob(datasetName, roleArn, source);
        LOG.info("Started ingestion job {} for dataset {} from {}", job.jobId(), datasetName, source);
        return job;
    }

    public PollResult<IngestionJob> run(
            String datasetName,
            String roleArn,
            ObjectRef source,
            CancellationToken token,
            Consumer<StatusTransition> listener) {
        return awaitCompletion(start(datasetName, roleArn, source), token, listener);
    }

    public PollResult<IngestionJob> awaitCompletion(
            IngestionJob job, CancellationToken token, Consumer<StatusTransition> listener) {
        Instant startedAt = loop.clock().instant();
        IngestionStatus[] lastSeen = {null};
        Consumer<StatusTransition> sink = listener == null ? transition -> { } : listener;

        PollResult<IngestionJob> result = loop.run(
                "DescribeIngestionJob " + job.jobId(),
                () -> {
                    IngestionJob current = service.describeIngestionJob(job.jobId());
                    if (current.status() != lastSeen[0]) {
                        StatusTransition transition = new StatusTransition(
                                job.jobId(), lastSeen[0], current.status(),
                                Duration.between(startedAt, loop.clock().instant()));
                        LOG.info("Ingestion job {} is {} (elapsed {})", job.jobId(), current.status(), transition.elapsed);
                        sink.accept(transition);
                        lastSeen[0] = current.status();
                    }
                    return current;
                },
                current -> current.status().isTerminal(),
                pollInterval,
                maxWait,
                token);

        if (result.isCompleted() && result.lastValue.status() == IngestionStatus.FAILED) {
            LOG.warn("Ingestion job {} failed: {}", job.jobId(),
                    StringSemantics.firstNonBlank(result.lastValue.failureReason(), "no reason reported"));
        } else if (!result.isCompleted()) {
            LOG.warn("Stopped waiting for ingestion job {}: {}", job.jobId(), result.outcome);
        }
        return result;
    }
}
