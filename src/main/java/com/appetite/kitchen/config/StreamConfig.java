package com.appetite.kitchen.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class StreamConfig {

    /**
     * One thread per open ticket stream. Streams beyond the pool size are rejected rather
     * than queued, since a queued stream would never see its snapshot.
     */
    @Bean(name = "kitchenStreamExecutor")
    public ThreadPoolTaskExecutor kitchenStreamExecutor(KitchenProperties properties) {
        int maxSubscribers = properties.getStream().getMaxSubscribers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxSubscribers);
        executor.setMaxPoolSize(maxSubscribers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("ticket-stream-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
