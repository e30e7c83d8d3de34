package com.enms.analytics.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class AnalyticsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded retry for reads against the time-series store. Only transient failures are retried.
     */
    @Bean
    public Retry storeReadRetry(@Value("${store.read.max-attempts:3}") int maxAttempts,
                                @Value("${store.read.wait-ms:200}") long waitMs) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(waitMs))
                .retryExceptions(TransientDataAccessException.class, RecoverableDataAccessException.class)
                .build();
        Retry retry = Retry.of("store-read", config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying store read (attempt {}): {}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }

    /**
     * Workers for training and detection jobs, separate from request-handling threads.
     */
    @Bean(name = "jobExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor jobExecutor(@Value("${jobs.executor.pool-size:2}") int poolSize,
                                              @Value("${jobs.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("job-");
        executor.initialize();
        return executor;
    }

    /**
     * Single dispatch thread so every subscriber sees events in publish order.
     */
    @Bean(name = "eventExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor eventExecutor(@Value("${events.queue-capacity:10000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.initialize();
        return executor;
    }
}
