package com.equipmenthealth.scheduler.polling;

import com.equipmenthealth.scheduler.error.TransportFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Fixed-cadence polling with a mandatory upper bound and a cancellation token.
 *
 * <p>Transport failures are retried at the loop's cadence; every other exception thrown by the
 * attempt propagates immediately. The loop makes one final attempt at the deadline before
 * reporting {@link PollOutcome#TIMED_OUT}.</p>
 */
public final class PollingLoop {
    private static final Logger LOG = LoggerFactory.getLogger(PollingLoop.class);

    private final Clock clock;
    private final Sleeper sleeper;

    public PollingLoop(Clock clock, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public static PollingLoop system() {
        return new PollingLoop(Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public Clock clock() {
        return clock;
    }

    public <T> PollResult<T> run(
            String operation,
            Supplier<T> attempt,
            Predicate<T> done,
            Duration interval,
            Duration maxWait,
            CancellationToken token) {
        Objects.requireNonNull(maxWait, "maxWait");
        Objects.requireNonNull(token, "token");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Polling interval must be positive: " + interval);
        }

        Instant started = clock.instant();
        int attempts = 0;
        T last = null;
        TransportFailureException lastFailure = null;
        while (true) {
            if (token.isCancelled()) {
                LOG.info("{} cancelled after {} attempts", operation, attempts);
                return new PollResult<>(PollOutcome.CANCELLED, last, attempts, elapsedSince(started), lastFailure);
            }
            attempts++;
            try {
                last = attempt.get();
                if (done.test(last)) {
                    return new PollResult<>(PollOutcome.COMPLETED, last, attempts, elapsedSince(started), lastFailure);
                }
            } catch (TransportFailureException ex) {
                lastFailure = ex;
                LOG.warn("{} attempt {} failed, retrying in {}: {}", operation, attempts, interval, ex.getMessage());
            }

            Duration remaining = maxWait.minus(elapsedSince(started));
            if (remaining.isNegative() || remaining.isZero()) {
                LOG.warn("{} gave up after {} attempts (maxWait={})", operation, attempts, maxWait);
                return new PollResult<>(PollOutcome.TIMED_OUT, last, attempts, elapsedSince(started), lastFailure);
            }
            Duration pause = remaining.compareTo(interval) < 0 ? remaining : interval;
            LOG.debug("{} not done after attempt {}, sleeping {}", operation, attempts, pause);
            if (!sleeper.sleep(pause, token)) {
                LOG.info("{} cancelled while waiting after {} attempts", operation, attempts);
                return new PollResult<>(PollOutcome.CANCELLED, last, attempts, elapsedSince(started), lastFailure);
            }
        }
    }

    private Duration elapsedSince(Instant started) {
        return Duration.between(started, clock.instant());
    }
}
