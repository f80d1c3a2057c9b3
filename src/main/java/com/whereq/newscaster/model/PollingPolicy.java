package com.whereq.newscaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Interval and budget for polling one job
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PollingPolicy {

    /**
     * Wait between status checks
     */
    @Builder.Default
    private Duration interval = Duration.ofSeconds(30);

    /**
     * Maximum status checks before giving up with POLLING_TIMEOUT
     */
    @Builder.Default
    private int maxAttempts = 30;

    /**
     * Poll until a terminal status or cancellation, ignoring maxAttempts
     */
    @Builder.Default
    private boolean indefinite = false;

    /**
     * Transport timeout of a single status check
     */
    @Builder.Default
    private Duration perCallTimeout = Duration.ofSeconds(30);

    /**
     * Retries of one attempt after a transient error
     */
    @Builder.Default
    private int transientRetries = 3;

    /**
     * Initial backoff after a transient error
     */
    @Builder.Default
    private Duration transientBackoff = Duration.ofSeconds(1);

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private int backoffMultiplier = 2;

    /**
     * Maximum backoff after a transient error
     */
    @Builder.Default
    private Duration maxTransientBackoff = Duration.ofSeconds(10);

    public static PollingPolicy defaultPolicy() {
        return PollingPolicy.builder().build();
    }

    /**
     * Check if another status check is allowed after {@code attempts} checks
     */
    public boolean allowsAnotherAttempt(int attempts) {
        return indefinite || attempts < maxAttempts;
    }

    /**
     * Exponential backoff for the given transient retry (0-based), capped by
     * {@link #maxTransientBackoff} and by the polling interval
     */
    public Duration transientBackoff(int retry) {
        long initial = transientBackoff.toMillis();
        long backoff = (long) (initial * Math.pow(Math.max(1, backoffMultiplier), retry));
        long cap = Math.min(maxTransientBackoff.toMillis(), interval.toMillis());
        return Duration.ofMillis(Math.max(0, Math.min(backoff, cap)));
    }

    /**
     * Reject policies that cannot terminate or make no progress
     */
    public void validate() {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("Polling interval must not be negative");
        }
        if (!indefinite && maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 unless polling indefinitely");
        }
        if (transientRetries < 0) {
            throw new IllegalArgumentException("transientRetries must not be negative");
        }
    }
}
