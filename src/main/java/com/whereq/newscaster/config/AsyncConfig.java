package com.whereq.newscaster.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for batch runs and for items within a run
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "batchExecutor")
    public ThreadPoolTaskExecutor batchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);   // Concurrent batch runs
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(10); // Runs waiting for a slot
        executor.setThreadNamePrefix("batch-run-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Item pool, only used when parallelism is above one
     */
    @Bean(name = "itemExecutor")
    public ThreadPoolTaskExecutor itemExecutor(NewscasterProperties properties) {
        int parallelism = Math.max(1, properties.getPipeline().getParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(properties.getPipeline().getMaxBatchSize());
        executor.setThreadNamePrefix("batch-item-");
        executor.initialize();
        return executor;
    }
}
