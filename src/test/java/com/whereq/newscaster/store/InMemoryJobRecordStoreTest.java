package com.whereq.newscaster.store;

import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.JobKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobRecordStoreTest {

    private final InMemoryJobRecordStore store = new InMemoryJobRecordStore();

    @Test
    @DisplayName("The same id always maps to the same lock")
    void lockIsStablePerId() {
        assertThat(store.lockFor("abc123")).isSameAs(store.lockFor(new String("abc123")));
    }

    @Test
    @DisplayName("Lock count stays bounded however many jobs pass through")
    void locksAreBounded() {
        // given
        Set<ReentrantLock> distinct = Collections.newSetFromMap(new IdentityHashMap<>());

        // when
        for (int i = 0; i < 10_000; i++) {
            String id = "job-" + i;
            store.save(Job.submitted(id, JobKind.VIDEO_RENDER, List.of(), Instant.parse("2024-05-01T10:00:00Z")));
            store.update(id, job -> job.setAttempts(1));
            distinct.add(store.lockFor(id));
        }

        // then
        assertThat(distinct).hasSizeLessThanOrEqualTo(64);
        assertThat(store.count()).isEqualTo(10_000);
        assertThat(store.load("job-9999").getAttempts()).isEqualTo(1);
    }
}
