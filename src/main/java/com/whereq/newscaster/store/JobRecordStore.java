package com.whereq.newscaster.store;

import com.whereq.newscaster.exception.JobNotFoundException;
import com.whereq.newscaster.model.Job;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable job state keyed by job id
 */
public interface JobRecordStore {

    /**
     * Create or replace a job record. A stored terminal status is kept.
     *
     * @param job the job to store
     * @return the job as stored
     */
    Job save(Job job);

    /**
     * Load a job
     *
     * @param id job identifier
     * @return the stored job
     * @throws JobNotFoundException when no record exists
     */
    default Job load(String id) {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * Find a job
     *
     * @param id job identifier
     * @return the stored job, if any
     */
    Optional<Job> find(String id);

    /**
     * Atomic read-modify-write of one job. Serialized per id; different ids
     * do not block each other.
     *
     * @param id job identifier
     * @param mutator applied to a copy of the stored job
     * @return the job as stored after the update
     * @throws JobNotFoundException when no record exists
     */
    Job update(String id, Consumer<Job> mutator);

    /**
     * All stored jobs
     */
    List<Job> list();

    /**
     * Number of stored jobs, without loading the records
     */
    long count();
}
