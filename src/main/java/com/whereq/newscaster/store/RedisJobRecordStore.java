package com.whereq.newscaster.store;

import com.whereq.newscaster.exception.JobStoreException;
import com.whereq.newscaster.model.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Job records in Redis: one JSON string per job ({@code <prefix>record:<id>})
 * plus an index set of ids ({@code <prefix>ids}).
 * Records never expire; retention is handled outside this service.
 */
@Slf4j
public class RedisJobRecordStore extends AbstractJobRecordStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final JobRecordCodec codec;
    private final String keyPrefix;
    private final Duration timeout;

    public RedisJobRecordStore(ReactiveRedisTemplate<String, String> redisTemplate,
                               JobRecordCodec codec,
                               String keyPrefix,
                               Duration timeout) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.keyPrefix = keyPrefix;
        this.timeout = timeout;
    }

    @Override
    protected Optional<Job> read(String id) {
        String json = block(redisTemplate.opsForValue().get(recordKey(id)), "read " + id);
        return Optional.ofNullable(json).map(codec::decode);
    }

    @Override
    protected void write(Job job) {
        String json = codec.encode(job);
        Boolean stored = block(redisTemplate.opsForValue().set(recordKey(job.getId()), json)
            .flatMap(ok -> redisTemplate.opsForSet().add(indexKey(), job.getId()).thenReturn(ok)),
            "write " + job.getId());
        if (!Boolean.TRUE.equals(stored)) {
            throw new JobStoreException("Redis refused job record " + job.getId());
        }
        log.debug("Job {} stored: {}", job.getId(), job.getStatus());
    }

    @Override
    protected List<Job> readAll() {
        List<String> ids = block(redisTemplate.opsForSet().members(indexKey()).sort().collectList(), "list");
        if (ids == null) {
            return List.of();
        }
        return ids.stream()
            .map(this::read)
            .flatMap(Optional::stream)
            .toList();
    }

    @Override
    public long count() {
        Long size = block(redisTemplate.opsForSet().size(indexKey()), "count");
        return size == null ? 0 : size;
    }

    private <T> T block(Mono<T> operation, String description) {
        try {
            return operation.block(timeout);
        } catch (RuntimeException e) {
            throw new JobStoreException("Redis operation failed: " + description, e);
        }
    }

    String recordKey(String id) {
        return keyPrefix + "record:" + id;
    }

    String indexKey() {
        return keyPrefix + "ids";
    }
}
