package com.equipmenthealth.scheduler.execution;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.TransportFailureException;
import com.equipmenthealth.scheduler.model.ExecutionSummary;
import com.equipmenthealth.scheduler.polling.CancellationToken;
import com.equipmenthealth.scheduler.polling.PollResult;
import com.equipmenthealth.scheduler.polling.PollingLoop;
import com.equipmenthealth.scheduler.remote.ExecutionPage;
import com.equipmenthealth.scheduler.remote.InferenceService;
import com.equipmenthealth.scheduler.remote.ListExecutionsRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lists a schedule's executions and waits, within a bound, for the first one to appear.
 *
 * <p>{@link #list} pages through ListExecutions and returns summaries in ascending fire-time order
 * with one entry per fire time, so the same filters against unchanged remote state always yield
 * the same sequence. A continuation token seen twice in one listing is a transport failure.</p>
 */
public class ExecutionPoller {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionPoller.class);

    private final InferenceService service;
    private final PollingLoop loop;
    private final int pageSize;
    private final Duration pollInterval;

    public ExecutionPoller(InferenceService service, PollingLoop loop, int pageSize, Duration pollInterval) {
        this.service = Objects.requireNonNull(service, "service");
        this.loop = Objects.requireNonNull(loop, "loop");
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    public List<ExecutionSummary> list(ExecutionQuery query) {
        TreeMap<Instant, ExecutionSummary> byFireTime = new TreeMap<>();
        ListExecutionsRequest request = new ListExecutionsRequest(
                query.scheduleName, query.fireTimeRange, query.statusFilter, pageSize, null);
        Set<String> seenTokens = new HashSet<>();
        int pages = 0;
        do {
            ExecutionPage page = service.listExecutions(request);
            pages++;
            for (ExecutionSummary summary : page.items) {
                if (query.accepts(summary)) {
                    byFireTime.put(summary.fireTime(), summary);
                }
            }
            if (page.nextToken != null && !seenTokens.add(page.nextToken)) {
                throw new TransportFailureException("ListExecutions", ErrorContext.schedule(query.scheduleName),
                        new IllegalStateException("page token " + page.nextToken + " returned twice after " + pages + " pages"));
            }
            request = page.nextToken == null ? null : request.withNextToken(page.nextToken);
        } while (request != null);
        LOG.debug("Listed {} executions in {} pages for {}", byFireTime.size(), pages, query);
        return new ArrayList<>(byFireTime.values());
    }

    /**
     * Repeats {@link #list} until it returns at least one execution, {@code maxWait} elapses or the
     * token is cancelled. Transport failures are retried at the poll interval.
     */
    public PollResult<List<ExecutionSummary>> awaitFirstResult(
            ExecutionQuery query, Duration maxWait, CancellationToken token) {
        LOG.info("Waiting up to {} for the first execution matching {}", maxWait, query);
        PollResult<List<ExecutionSummary>> result = loop.run(
                "ListExecutions " + query.scheduleName,
                () -> list(query),
                summaries -> !summaries.isEmpty(),
                pollInterval,
                maxWait,
                token);
        if (result.isCompleted()) {
            LOG.info("Found {} executions for {} after {} attempts",
                    result.lastValue.size(), query.scheduleName, result.attempts);
        }
        return result;
    }

    /**
     * Lists with the given filters, folds the result into the caller's ledger and returns only the
     * summaries that are new or whose status changed since the last refresh.
     */
    public List<ExecutionSummary> refresh(ExecutionLedger ledger, ExecutionQuery query) {
        if (!ledger.scheduleName().equals(query.scheduleName)) {
            throw new IllegalArgumentException(
                    "Ledger for " + ledger.scheduleName() + " cannot be refreshed from " + query.scheduleName);
        }
        List<ExecutionSummary> changed = ledger.record(list(query));
        LOG.debug("Refresh of {} observed {} new or changed executions (ledger size {})",
                query.scheduleName, changed.size(), ledger.size());
        return changed;
    }
}
