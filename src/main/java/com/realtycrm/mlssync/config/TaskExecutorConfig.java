package com.realtycrm.mlssync.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for sync runs and media processing, plus the clock every time-based decision reads.
 */
@Configuration
@RequiredArgsConstructor
public class TaskExecutorConfig {

    private final MlsSyncProperties properties;

    /**
     * Runs provider syncs. One run occupies one thread for its whole duration; providers run side by side.
     * A full queue rejects the trigger, which releases the run lock again.
     */
    @Bean("syncRunExecutor")
    public AsyncTaskExecutor syncRunExecutor() {
        final MlsSyncProperties.Executor config = properties.getExecutor();
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("sync-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Bounded pool for media downloads and uploads. When both pool and queue are full the submitting thread
     * processes the item itself, which throttles the sync run feeding the queue.
     */
    @Bean("mediaTaskExecutor")
    public AsyncTaskExecutor mediaTaskExecutor() {
        final MlsSyncProperties.Media config = properties.getMedia();
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("media-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
