package com.wpanther.ticketbulkops.config;

import com.wpanther.ticketbulkops.batch.Sleeper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for background bulk job execution
 */
@Configuration
public class AsyncConfig {

    @Value("${app.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${app.async.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${app.async.queue-capacity:100}")
    private int queueCapacity;

    @Value("${app.async.thread-name-prefix:bulk-job-}")
    private String threadNamePrefix;

    /**
     * Thread pool running the bulk job workers
     *
     * @return configured Executor for bulk jobs
     */
    @Bean(name = "bulkJobExecutor")
    public Executor bulkJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // Reject instead of running on the caller: request threads must never execute a batch
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Real pacing between remote calls
     */
    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
