package com.platform.paas.lifecycle;

import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.queue.QueueStats;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.schedule.ScheduledTrigger;
import com.platform.paas.worker.WorkerPoolManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown manager.
 * 
 * Order:
 * 1. Stop the scheduled trigger
 * 2. Close the queue to new work (admissions now fail closed)
 * 3. Drain the worker pools within the shutdown timeout
 * 4. Flush Kafka
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {
    
    private final ApplicationLifecycleManager lifecycleManager;
    private final ScheduledTrigger trigger;
    private final ReconciliationQueue queue;
    private final WorkerPoolManager workerPools;
    private final KafkaTemplate<?, ?> kafkaTemplate;
    private final MetricsRegistry metricsRegistry;
    
    @Value("${controlplane.shutdown.timeout-seconds:30}")
    private int shutdownTimeoutSeconds = 30;
    
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    public GracefulShutdownManager(
            ApplicationLifecycleManager lifecycleManager,
            ScheduledTrigger trigger,
            ReconciliationQueue queue,
            WorkerPoolManager workerPools,
            KafkaTemplate<?, ?> kafkaTemplate,
            MetricsRegistry metricsRegistry) {
        this.lifecycleManager = lifecycleManager;
        this.trigger = trigger;
        this.queue = queue;
        this.workerPools = workerPools;
        this.kafkaTemplate = kafkaTemplate;
        this.metricsRegistry = metricsRegistry;
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }
    
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
    
    /**
     * Perform graceful shutdown.
     */
    public synchronized void performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        
        Instant shutdownStartTime = Instant.now();
        log.info("========== GRACEFUL SHUTDOWN INITIATED ==========");
        lifecycleManager.startDraining();
        
        log.info("[1/4] Stopping scheduled trigger...");
        trigger.stop();
        
        log.info("[2/4] Closing reconciliation queue...");
        queue.close();
        
        log.info("[3/4] Draining worker pools (timeout {}s)...", shutdownTimeoutSeconds);
        boolean drained = workerPools.drain(Duration.ofSeconds(shutdownTimeoutSeconds));
        QueueStats stats = queue.stats();
        if (stats.totalPending() > 0) {
            log.warn("{} task(s) still queued at shutdown; periodic runs will regenerate them", stats.totalPending());
        }
        
        log.info("[4/4] Flushing Kafka producer...");
        flushKafka();
        
        lifecycleManager.markStopped();
        metricsRegistry.incrementCounter("lifecycle.shutdown", "status", drained ? "complete" : "forced");
        
        Duration duration = Duration.between(shutdownStartTime, Instant.now());
        log.info("========== GRACEFUL SHUTDOWN COMPLETE ({} ms) ==========", duration.toMillis());
    }
    
    private void flushKafka() {
        try {
            kafkaTemplate.flush();
            log.info("Kafka producer flushed");
        } catch (RuntimeException e) {
            log.error("Error flushing Kafka", e);
        }
    }
}
