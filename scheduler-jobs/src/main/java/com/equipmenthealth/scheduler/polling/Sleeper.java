package com.equipmenthealth.scheduler.polling;

import java.time.Duration;

/**
 * Suspension point between polls.
 */
public interface Sleeper {

    /**
     * Waits for {@code duration}.
     *
     * @return false when the wait was cut short by cancellation or interruption
     */
    boolean sleep(Duration duration, CancellationToken token);

    /**
     * Waits on the token itself so a cancel wakes the sleeper immediately. An interrupt is treated
     * as a cancellation and the interrupt flag is restored.
     */
    Sleeper SYSTEM = (duration, token) -> {
        try {
            return !token.await(duration);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    };
}
