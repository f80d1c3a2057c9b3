package com.whereq.newscaster.polling;

import java.time.Duration;

/**
 * Waits between polling attempts
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Wait for {@code duration} unless the token is canceled first
     *
     * @return true if the full duration elapsed, false if woken by cancellation
     */
    boolean sleep(Duration duration, CancellationToken token) throws InterruptedException;

    /**
     * Real wall-clock wait that wakes on cancellation
     */
    static Sleeper cancellable() {
        return (duration, token) -> !token.await(duration);
    }
}
