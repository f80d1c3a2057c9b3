package com.whereq.newscaster.model;

/**
 * Error taxonomy shared by the client, poller, rehoster and pipeline
 */
public enum ErrorKind {
    /**
     * Malformed submission, never retried
     */
    VALIDATION,

    /**
     * Invalid or expired credentials
     */
    AUTH,

    /**
     * Timeout, connection failure or 5xx, retryable
     */
    TRANSIENT_NETWORK,

    /**
     * 2xx response that cannot be interpreted
     */
    UNEXPECTED_RESPONSE,

    /**
     * Unknown job id
     */
    NOT_FOUND,

    /**
     * Remote job ended in FAILED, REJECTED, CANCELED or TIMED_OUT
     */
    REMOTE_JOB_FAILURE,

    /**
     * Local polling budget exhausted while the remote job is still running
     */
    POLLING_TIMEOUT,

    /**
     * Artifact could not be copied to our storage
     */
    REHOST_FAILURE,

    /**
     * Caller canceled the operation
     */
    CANCELED,

    /**
     * Stage failure not raised by the job layer (collaborator errors)
     */
    STAGE_FAILURE;

    public boolean isRetryable() {
        return this == TRANSIENT_NETWORK;
    }
}
