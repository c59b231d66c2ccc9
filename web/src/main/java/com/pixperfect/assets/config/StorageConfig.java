package com.pixperfect.assets.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool that runs blob store and metadata store calls so the request thread can
 * stop waiting on them after the configured timeout.
 */
@Configuration
public class StorageConfig {

    @Value("${assets.storage.executor.core-pool-size:8}")
    private int corePoolSize;

    @Value("${assets.storage.executor.max-pool-size:32}")
    private int maxPoolSize;

    @Value("${assets.storage.executor.queue-capacity:200}")
    private int queueCapacity;

    @Bean(name = "storageExecutor")
    public ThreadPoolTaskExecutor storageExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("storage-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
