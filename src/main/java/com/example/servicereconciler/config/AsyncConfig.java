package com.example.servicereconciler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for probing and for outbound notifications.
 */
@Configuration
public class AsyncConfig {

    /**
     * Bounded pool for probes and for repair calls the tick waits on with a deadline.
     * The queue is unbounded in practice because a tick never submits more than one wave at a time.
     */
    @Bean(name = "probeExecutor")
    public ThreadPoolTaskExecutor probeExecutor(ReconcilerProperties properties) {
        int workers = Math.max(1, properties.getTick().getProbeConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("probe-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Single sender with a small queue. A saturated channel drops messages instead of
     * blocking the reconciler.
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(ReconcilerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Math.max(1, properties.getNotifications().getQueueCapacity()));
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }
}
