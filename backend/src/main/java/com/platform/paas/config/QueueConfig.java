package com.platform.paas.config;

import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.queue.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Reconciliation queue and its retry policy.
 */
@Configuration
public class QueueConfig {
    
    @Bean
    public RetryPolicy retryPolicy(
            @Value("${controlplane.queue.max-attempts:5}") int maxAttempts,
            @Value("${controlplane.queue.base-backoff-ms:8000}") long baseBackoffMs,
            @Value("${controlplane.queue.max-backoff-ms:3600000}") long maxBackoffMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(baseBackoffMs), Duration.ofMillis(maxBackoffMs));
    }
    
    @Bean
    public ReconciliationQueue reconciliationQueue(
            Clock clock,
            RetryPolicy retryPolicy,
            MetricsRegistry metricsRegistry,
            @Value("${controlplane.queue.max-depth:0}") int maxDepth) {
        return new ReconciliationQueue(clock, retryPolicy, maxDepth, metricsRegistry);
    }
}
