package com.whereq.newscaster.store;

import com.whereq.newscaster.exception.JobNotFoundException;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.JobStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Locking and merge rules shared by all store backends.
 * Backends only implement raw record access.
 */
@Slf4j
public abstract class AbstractJobRecordStore implements JobRecordStore {

    private static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    protected AbstractJobRecordStore() {
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    protected abstract Optional<Job> read(String id);

    protected abstract void write(Job job);

    protected abstract List<Job> readAll();

    @Override
    public Job save(Job job) {
        Objects.requireNonNull(job, "job");
        if (job.getId() == null || job.getId().isBlank()) {
            throw new IllegalArgumentException("Cannot store a job without an id");
        }
        ReentrantLock lock = lockFor(job.getId());
        lock.lock();
        try {
            Job candidate = job.copy();
            merge(read(job.getId()).orElse(null), candidate);
            write(candidate);
            return candidate.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Job> find(String id) {
        return read(id).map(Job::copy);
    }

    @Override
    public Job update(String id, Consumer<Job> mutator) {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Job current = read(id).orElseThrow(() -> new JobNotFoundException(id));
            Job candidate = current.copy();
            mutator.accept(candidate);
            merge(current, candidate);
            write(candidate);
            return candidate.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Job> list() {
        return readAll().stream().map(Job::copy).toList();
    }

    /**
     * Apply the invariants to a candidate record before it is written:
     * the id and creation time never change, a terminal status never reverts,
     * and POLLING_TIMEOUT is never persisted.
     */
    protected void merge(Job previous, Job candidate) {
        if (previous == null) {
            if (candidate.getStatus() == null || !candidate.getStatus().isPersistable()) {
                candidate.setStatus(JobStatus.PROCESSING);
            }
            return;
        }

        candidate.setId(previous.getId());
        if (previous.getCreatedAt() != null) {
            candidate.setCreatedAt(previous.getCreatedAt());
        }

        JobStatus before = previous.getStatus();
        JobStatus after = candidate.getStatus();

        if (after == null || !after.isPersistable()) {
            candidate.setStatus(before);
        } else if (before != null && before.isTerminal() && after != before) {
            log.debug("Job {} is already {}; ignoring status {}", previous.getId(), before, after);
            candidate.setStatus(before);
            candidate.setError(previous.getError());
            candidate.setRemoteOutputUrl(previous.getRemoteOutputUrl());
        }
    }

    /**
     * Fixed set of striped locks, so memory stays flat however many ids pass through.
     */
    ReentrantLock lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), locks.length)];
    }
}
