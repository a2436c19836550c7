/**
 * Thread pool configuration for source acquisition
 *
 * @author William Callahan
 *
 * Features:
 * - Dedicated executor for the concurrent Source Client batches of a run
 * - Bounded queue capacity so a stuck run cannot pile up work
 * - Custom thread naming for easier debugging of per-source traffic
 * - Shared scheduler for the cron triggers and per-run timeouts
 */

package com.williamcallahan.steam_analytics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Executor the orchestrator fans source batches out to
     *
     * Features:
     * - Core pool of 3 threads, one per external source
     * - Max pool of 6 threads so a late run can overlap a shutting-down one
     * - Fallback to caller thread when saturated (CallerRunsPolicy)
     */
    @Bean("ingestionTaskExecutor")
    public AsyncTaskExecutor ingestionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(6);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30); // cancelled runs unwind quickly
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        logger.debug("Initialized ingestion executor (core={}, max={})", executor.getCorePoolSize(), executor.getMaxPoolSize());
        return executor;
    }

    /**
     * Scheduler behind {@code @Scheduled} triggers and run timeouts. A scheduled run blocks one
     * thread for its whole duration, so the pool leaves room for the timeout that may cancel it.
     */
    @Bean("taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("ingest-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
