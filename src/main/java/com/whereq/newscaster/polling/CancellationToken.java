package com.whereq.newscaster.polling;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal. Waiting through {@link #await(Duration)}
 * wakes up as soon as the token is canceled, so cancellation latency is not
 * bound to the length of the wait.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile String reason;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Token that can never be canceled. Not accepted for indefinite polling.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancellable() {
        return cancellable;
    }

    /**
     * Signal cancellation. Idempotent; only the first reason is kept.
     */
    public void cancel(String reason) {
        if (!cancellable) {
            throw new UnsupportedOperationException("This token cannot be canceled");
        }
        synchronized (this) {
            if (latch.getCount() == 0) {
                return;
            }
            this.reason = reason != null ? reason : "canceled";
            latch.countDown();
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Wait up to {@code timeout}
     *
     * @return true if the token was canceled before or during the wait
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
