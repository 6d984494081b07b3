package com.platform.paas.worker;

import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.queue.Band;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.schedule.ScheduleGenerations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Supervises one {@link BandWorkerPool} per band.
 * 
 * A periodic sample of each band's backlog feeds its {@link AutoscalePolicy}; the pool is
 * resized to the policy's answer. The same tick returns stale claims to the queue.
 */
@Slf4j
@Component
public class WorkerPoolManager {
    
    private final ReconciliationQueue queue;
    private final WorkerPoolProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final Map<Band, BandWorkerPool> pools;
    private final Map<Band, AutoscalePolicy> policies;
    
    private volatile boolean started;
    
    public WorkerPoolManager(
            ReconciliationQueue queue,
            TaskHandlerRegistry handlers,
            ScheduleGenerations generations,
            WorkerPoolProperties properties,
            MetricsRegistry metricsRegistry) {
        this.queue = queue;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
        
        Map<Band, BandWorkerPool> poolsByBand = new EnumMap<>(Band.class);
        Map<Band, AutoscalePolicy> policiesByBand = new EnumMap<>(Band.class);
        for (Band band : Band.values()) {
            WorkerPoolProperties.BandSettings settings = properties.forBand(band);
            if (settings.getMin() < 0 || settings.getMax() < Math.max(1, settings.getMin())) {
                throw new IllegalStateException(String.format(
                    "Invalid worker bounds for %s: min=%d max=%d", band.tag(), settings.getMin(), settings.getMax()));
            }
            poolsByBand.put(band, new BandWorkerPool(band, settings, properties.getPollTimeout(),
                queue, handlers, generations, metricsRegistry));
            policiesByBand.put(band, new AutoscalePolicy(settings));
        }
        this.pools = Collections.unmodifiableMap(poolsByBand);
        this.policies = policiesByBand;
    }
    
    /**
     * Start every band at its minimum size.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        pools.values().forEach(BandWorkerPool::start);
        started = true;
        log.info("Worker pools started");
    }
    
    /**
     * Sample every band and resize its pool. Also redelivers stale claims.
     */
    @Scheduled(fixedDelayString = "${controlplane.workers.autoscale-interval-ms:5000}")
    public void autoscale() {
        if (!started) {
            return;
        }
        try {
            queue.requeueStaleClaims(properties.getClaimVisibility());
            for (Band band : Band.values()) {
                BandWorkerPool pool = pools.get(band);
                int live = pool.liveExecutors();
                int desired = policies.get(band).sample(live, queue.readyDepth(band), pool.busyExecutors());
                if (desired != pool.targetExecutors()) {
                    String direction = desired > live ? "up" : "down";
                    log.info("Scaling {} workers {} from {} to {} (ready={}, busy={})",
                        band.tag(), direction, live, desired, queue.readyDepth(band), pool.busyExecutors());
                    pool.resize(desired);
                    metricsRegistry.recordScaling(band.tag(), direction, desired);
                } else if (live < desired) {
                    // Executors that died on an unexpected error are replaced.
                    pool.resize(desired);
                }
            }
        } catch (RuntimeException e) {
            log.error("Autoscale cycle failed: {}", e.getMessage(), e);
        }
    }
    
    /**
     * Drain every band within a shared deadline.
     *
     * @return true if all bands drained in time
     */
    public boolean drain(Duration timeout) {
        started = false;
        Instant deadline = Instant.now().plus(timeout);
        boolean drained = true;
        for (BandWorkerPool pool : pools.values()) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            try {
                drained &= pool.drain(remaining.isNegative() ? Duration.ZERO : remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining {} workers", pool.band().tag());
                return false;
            }
        }
        log.info("Worker pools drained (complete={})", drained);
        return drained;
    }
    
    public boolean isStarted() {
        return started;
    }
    
    public Map<Band, PoolStatus> status() {
        Map<Band, PoolStatus> status = new EnumMap<>(Band.class);
        pools.forEach((band, pool) -> {
            WorkerPoolProperties.BandSettings settings = properties.forBand(band);
            status.put(band, new PoolStatus(pool.liveExecutors(), pool.busyExecutors(),
                settings.getMin(), settings.getMax()));
        });
        return status;
    }
    
    public record PoolStatus(int live, int busy, int min, int max) {}
}
