package com.whereq.newscaster.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.newscaster.store.FileJobRecordStore;
import com.whereq.newscaster.store.InMemoryJobRecordStore;
import com.whereq.newscaster.store.JobRecordCodec;
import com.whereq.newscaster.store.JobRecordStore;
import com.whereq.newscaster.store.RedisJobRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.nio.file.Path;

/**
 * Selects the job record backend from {@code newscaster.store.type}
 */
@Slf4j
@Configuration
public class JobStoreConfig {

    @Bean
    public JobRecordCodec jobRecordCodec(ObjectMapper objectMapper) {
        return new JobRecordCodec(objectMapper);
    }

    @Bean
    public JobRecordStore jobRecordStore(NewscasterProperties properties, JobRecordCodec codec,
                                         ObjectProvider<ReactiveRedisTemplate<String, String>> redisTemplate) {
        NewscasterProperties.StoreConfig store = properties.getStore();
        log.info("Using {} job record store", store.getType());

        switch (store.getType()) {
            case FILE:
                return new FileJobRecordStore(Path.of(store.getDirectory()), codec);
            case MEMORY:
                return new InMemoryJobRecordStore();
            case REDIS:
            default:
                return new RedisJobRecordStore(redisTemplate.getObject(), codec,
                    store.getKeyPrefix(), store.getTimeout());
        }
    }
}
