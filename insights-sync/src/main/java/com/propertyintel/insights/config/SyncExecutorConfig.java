package com.propertyintel.insights.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for account sync runs.
 *
 * Runs are tracked tasks rather than detached threads: on shutdown the pool
 * stops taking work and waits (up to the configured grace period) for
 * in-flight runs to finish their current listing.
 */
@Slf4j
@Configuration
public class SyncExecutorConfig {

    @Bean
    public ThreadPoolTaskExecutor syncExecutor(InsightsSyncProperties properties) {
        long graceSeconds = properties.getScheduling().getShutdownGrace().toSeconds();
        int threads = properties.getSync().getAccountParallelism();
        log.info("Creating sync executor ({} threads, shutdown grace {}s)", threads, graceSeconds);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("account-sync-");
        // Unbounded queue: the in-flight registry admits at most one task per account.
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) Math.min(Integer.MAX_VALUE, graceSeconds));
        return executor;
    }
}
