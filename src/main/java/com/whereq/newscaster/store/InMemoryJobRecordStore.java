package com.whereq.newscaster.store;

import com.whereq.newscaster.model.Job;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store for tests and dry runs
 */
public class InMemoryJobRecordStore extends AbstractJobRecordStore {

    private final ConcurrentHashMap<String, Job> records = new ConcurrentHashMap<>();

    @Override
    protected Optional<Job> read(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    protected void write(Job job) {
        records.put(job.getId(), job.copy());
    }

    @Override
    protected List<Job> readAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public long count() {
        return records.size();
    }
}
