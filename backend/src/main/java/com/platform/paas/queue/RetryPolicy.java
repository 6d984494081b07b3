package com.platform.paas.queue;

import java.time.Duration;

/**
 * Exponential backoff for failed tasks: {@code min(base * 2^(attempt-1), max)}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
    
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }
    }
    
    /**
     * Delay before the given attempt is retried (attempt counts from 1).
     */
    public Duration delayFor(int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long millis = baseDelay.toMillis() * (1L << shift);
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }
    
    public boolean isExhausted(int attempts) {
        return attempts >= maxAttempts;
    }
}
