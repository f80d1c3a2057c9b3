package com.whereq.newscaster.model;

import java.util.Locale;

/**
 * Render job lifecycle states
 *
 * State transitions:
 * SUBMITTED → PENDING → PROCESSING → {COMPLETED, FAILED, REJECTED, CANCELED, TIMED_OUT}
 * A stored terminal state never reverts. POLLING_TIMEOUT is reported to callers only.
 */
public enum JobStatus {
    /**
     * Accepted by the remote service, no status check yet
     */
    SUBMITTED,

    /**
     * Waiting in the remote queue
     */
    PENDING,

    /**
     * Remote service is rendering
     */
    PROCESSING,

    /**
     * Rendered successfully
     */
    COMPLETED,

    /**
     * Remote rendering failed
     */
    FAILED,

    /**
     * Remote service refused the input
     */
    REJECTED,

    /**
     * Canceled on the remote side
     */
    CANCELED,

    /**
     * Remote service gave up on the job
     */
    TIMED_OUT,

    /**
     * Caller stopped waiting; the remote job may still be running
     */
    POLLING_TIMEOUT;

    /**
     * Check if no further remote progress will occur
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == REJECTED
            || this == CANCELED || this == TIMED_OUT;
    }

    /**
     * Check if this is a terminal state other than COMPLETED
     */
    public boolean isFailure() {
        return isTerminal() && this != COMPLETED;
    }

    /**
     * POLLING_TIMEOUT is a local decision and is never written to the store
     */
    public boolean isPersistable() {
        return this != POLLING_TIMEOUT;
    }

    /**
     * Map a remote status string. Unknown or missing values are treated as PROCESSING.
     */
    public static JobStatus fromRemote(String value) {
        if (value == null || value.isBlank()) {
            return PROCESSING;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("CANCELLED".equals(normalized)) {
            return CANCELED;
        }
        try {
            JobStatus status = JobStatus.valueOf(normalized);
            return status == POLLING_TIMEOUT ? PROCESSING : status;
        } catch (IllegalArgumentException e) {
            return PROCESSING;
        }
    }
}
