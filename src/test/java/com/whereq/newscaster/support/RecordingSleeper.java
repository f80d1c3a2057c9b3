package com.whereq.newscaster.support;

import com.whereq.newscaster.polling.CancellationToken;
import com.whereq.newscaster.polling.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntConsumer;

/**
 * Sleeper that returns immediately and records every requested wait
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private IntConsumer onSleep = n -> { };

    /**
     * Run an action before the n-th (1-based) wait returns, e.g. to cancel a token
     */
    public RecordingSleeper onSleep(IntConsumer action) {
        this.onSleep = action;
        return this;
    }

    @Override
    public boolean sleep(Duration duration, CancellationToken token) {
        sleeps.add(duration);
        onSleep.accept(sleeps.size());
        return !token.isCancelled();
    }

    public List<Duration> sleeps() {
        return sleeps;
    }
}
