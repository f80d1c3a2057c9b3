package com.whereq.newscaster.polling;

import com.whereq.newscaster.exception.RenderJobException;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.StatusPayload;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans callbacks out to several listeners. A failing listener is logged and
 * never interrupts polling.
 */
@Slf4j
public class CompositePollListener implements PollListener {

    private final List<PollListener> listeners;

    public CompositePollListener(List<PollListener> listeners) {
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    @Override
    public void onStatus(Job job, StatusPayload payload) {
        each(job, l -> l.onStatus(job, payload));
    }

    @Override
    public void onTransientError(Job job, int attempt, int retry, RenderJobException error) {
        each(job, l -> l.onTransientError(job, attempt, retry, error));
    }

    @Override
    public void onTerminal(Job job) {
        each(job, l -> l.onTerminal(job));
    }

    @Override
    public void onPollingTimeout(Job job) {
        each(job, l -> l.onPollingTimeout(job));
    }

    @Override
    public void onCanceled(Job job) {
        each(job, l -> l.onCanceled(job));
    }

    private void each(Job job, Consumer<PollListener> callback) {
        for (PollListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Poll listener {} failed for job {}: {}",
                    listener.getClass().getSimpleName(), job != null ? job.getId() : null, e.getMessage());
            }
        }
    }
}
