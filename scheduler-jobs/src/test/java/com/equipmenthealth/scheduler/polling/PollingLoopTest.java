package com.equipmenthealth.scheduler.polling;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.MalformedResultException;
import com.equipmenthealth.scheduler.error.TransportFailureException;
import com.equipmenthealth.scheduler.support.ManualClock;
import com.equipmenthealth.scheduler.support.ManualSleeper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PollingLoopTest {
    private static final Duration INTERVAL = Duration.ofSeconds(60);

    private final ManualClock clock = new ManualClock(Instant.parse("2021-01-27T09:00:00Z"));

    @Test
    void completesAsSoonAsTheConditionHolds() {
        ManualSleeper sleeper = new ManualSleeper(clock);
        PollingLoop loop = new PollingLoop(clock, sleeper);
        AtomicInteger calls = new AtomicInteger();

        PollResult<Integer> result = loop.run(
                "count", calls::incrementAndGet, n -> n >= 3, INTERVAL, Duration.ofMinutes(10), new CancellationToken());

        assertEquals(PollOutcome.COMPLETED, result.outcome);
        assertEquals(3, result.lastValue);
        assertEquals(3, result.attempts);
        assertEquals(Duration.ofMinutes(2), result.elapsed);
        assertEquals(List.of(INTERVAL, INTERVAL), sleeper.sleeps());
    }

    @Test
    void timesOutAfterAFinalAttemptAtTheDeadline() {
        ManualSleeper sleeper = new ManualSleeper(clock);
        PollingLoop loop = new PollingLoop(clock, sleeper);

        PollResult<String> result = loop.run(
                "never", () -> "pending", value -> false, INTERVAL, Duration.ofSeconds(150), new CancellationToken());

        assertEquals(PollOutcome.TIMED_OUT, result.outcome);
        assertEquals(4, result.attempts);
        assertEquals(Duration.ofSeconds(150), result.elapsed);
        assertEquals(List.of(INTERVAL, INTERVAL, Duration.ofSeconds(30)), sleeper.sleeps());
    }

    @Test
    void cancellationStopsTheLoopWithoutFurtherAttempts() {
        ManualSleeper sleeper = new ManualSleeper(clock).cancelAfter(2);
        PollingLoop loop = new PollingLoop(clock, sleeper);
        AtomicInteger calls = new AtomicInteger();

        PollResult<Integer> result = loop.run(
                "cancel", calls::incrementAndGet, n -> false, INTERVAL, Duration.ofHours(1), new CancellationToken());

        assertEquals(PollOutcome.CANCELLED, result.outcome);
        assertEquals(2, calls.get());
    }

    @Test
    void alreadyCancelledTokenMakesNoAttempt() {
        PollingLoop loop = new PollingLoop(clock, new ManualSleeper(clock));
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        PollResult<Integer> result = loop.run("cancelled", calls::incrementAndGet, n -> true, INTERVAL, Duration.ofHours(1), token);

        assertEquals(PollOutcome.CANCELLED, result.outcome);
        assertEquals(0, result.attempts);
        assertEquals(0, calls.get());
    }

    @Test
    void transportFailuresAreRetriedAtTheLoopCadence() {
        PollingLoop loop = new PollingLoop(clock, new ManualSleeper(clock));
        AtomicInteger calls = new AtomicInteger();

        PollResult<String> result = loop.run("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransportFailureException("Describe", ErrorContext.NONE, new IOException("reset"));
            }
            return "done";
        }, "done"::equals, INTERVAL, Duration.ofMinutes(10), new CancellationToken());

        assertTrue(result.isCompleted());
        assertEquals(3, result.attempts);
        assertNotNull(result.lastTransportFailure);
    }

    @Test
    void otherFailuresPropagateImmediately() {
        PollingLoop loop = new PollingLoop(clock, new ManualSleeper(clock));

        assertThrows(MalformedResultException.class, () -> loop.run("broken", () -> {
            throw new MalformedResultException("bad", ErrorContext.NONE);
        }, value -> true, INTERVAL, Duration.ofMinutes(10), new CancellationToken()));
    }

    @Test
    void boundIsMandatory() {
        PollingLoop loop = new PollingLoop(clock, new ManualSleeper(clock));

        assertThrows(NullPointerException.class,
                () -> loop.run("unbounded", () -> 1, n -> true, INTERVAL, null, new CancellationToken()));
        assertThrows(IllegalArgumentException.class,
                () -> loop.run("spin", () -> 1, n -> true, Duration.ZERO, Duration.ofMinutes(1), new CancellationToken()));
    }

    @Test
    void systemSleeperWakesOnCancel() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertFalse(Sleeper.SYSTEM.sleep(Duration.ofHours(1), token));
    }
}
