package com.whereq.newscaster.polling;

import com.whereq.newscaster.exception.RenderJobException;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.StatusPayload;

/**
 * Progress callbacks of the poller. Kept apart from the polling algorithm so
 * logging, metrics and notifications can be swapped without touching it.
 */
public interface PollListener {

    /**
     * A status check succeeded and was persisted
     */
    default void onStatus(Job job, StatusPayload payload) {
    }

    /**
     * A status check failed transiently and will be retried
     */
    default void onTransientError(Job job, int attempt, int retry, RenderJobException error) {
    }

    /**
     * The job reached a terminal status
     */
    default void onTerminal(Job job) {
    }

    /**
     * The polling budget ran out while the job was still running
     */
    default void onPollingTimeout(Job job) {
    }

    /**
     * Polling stopped on cancellation
     */
    default void onCanceled(Job job) {
    }
}
