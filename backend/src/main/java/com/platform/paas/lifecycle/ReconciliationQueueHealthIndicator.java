package com.platform.paas.lifecycle;

import com.platform.paas.queue.QueueStats;
import com.platform.paas.queue.ReconciliationQueue;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * UP while the queue accepts work.
 */
@Component
public class ReconciliationQueueHealthIndicator implements HealthIndicator {
    
    private final ReconciliationQueue queue;
    
    public ReconciliationQueueHealthIndicator(ReconciliationQueue queue) {
        this.queue = queue;
    }
    
    @Override
    public Health health() {
        QueueStats stats = queue.stats();
        Health.Builder builder = stats.available() ? Health.up() : Health.down();
        return builder
            .withDetail("ready", stats.ready())
            .withDetail("delayed", stats.delayed())
            .withDetail("inFlight", stats.inFlight())
            .withDetail("dead", stats.dead())
            .build();
    }
}
