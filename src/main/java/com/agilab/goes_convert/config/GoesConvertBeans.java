package com.agilab.goes_convert.config;

import com.agilab.goes_convert.exception.SourceNotReadyException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bean configuration for the ingestion pipeline.
 * Provides the worker executor and the retry template used while waiting for a source file.
 */
@Configuration
public class GoesConvertBeans {

    /**
     * RetryTemplate for the source readiness wait.
     * Backs off exponentially up to the configured ceiling and gives up after the configured attempts.
     */
    @Bean
    public RetryTemplate sourceReadinessRetryTemplate(SatelliteProperties properties) {
        return RetryTemplate.builder()
                .maxAttempts(properties.getSourceReadyAttempts())
                .exponentialBackoff(properties.getSourceReadyInitialDelay().toMillis(), 2.0,
                        properties.getSourceReadyMaxDelay().toMillis())
                .retryOn(SourceNotReadyException.class)
                .build();
    }

    /**
     * Bounded pool for per-file workers. The queue is unbounded so the watcher thread never blocks on a burst.
     */
    @Bean
    public TaskExecutor workerExecutor(SatelliteProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setThreadNamePrefix("file-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(properties.getShutdownAwait().toMillis());
        return executor;
    }
}
