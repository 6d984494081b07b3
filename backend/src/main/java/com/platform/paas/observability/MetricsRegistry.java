package com.platform.paas.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Central registry for all controller metrics.
 * Provides methods for recording admission decisions, queue traffic and task execution.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }
    
    /**
     * Register a gauge backed by a live value supplier.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier, String... tags) {
        Gauge.builder(name, valueSupplier)
            .description(description)
            .tags(tags)
            .register(meterRegistry);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Record latency for an operation.
     */
    public void recordLatency(String name, Duration duration, String... tags) {
        String key = name + String.join(".", tags);
        Timer timer = timers.computeIfAbsent(key, k -> 
            Timer.builder(name)
                .tags(tags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        
        timer.record(duration);
    }
    
    /**
     * Record an admission decision. Reason is "none" for admitted requests.
     */
    public void recordAdmission(boolean admitted, String reason, int mutations) {
        incrementCounter("controlplane.admission.requests",
            "outcome", admitted ? "admitted" : "rejected",
            "reason", reason);
        if (mutations > 0) {
            counters.computeIfAbsent("controlplane.admission.mutations", k ->
                Counter.builder(k).register(meterRegistry))
                .increment(mutations);
        }
    }
    
    /**
     * Record a task entering the queue.
     */
    public void recordEnqueue(String kind, String band) {
        incrementCounter("controlplane.queue.enqueued", "kind", kind, "band", band);
    }
    
    /**
     * Record a terminal or retryable task outcome (succeeded, retried, dead, abandoned, redelivered).
     */
    public void recordTaskOutcome(String kind, String band, String outcome) {
        incrementCounter("controlplane.task.outcome", "kind", kind, "band", band, "outcome", outcome);
        log.debug("Recorded task outcome {} for {} on {}", outcome, kind, band);
    }
    
    /**
     * Record handler execution time.
     */
    public void recordTaskDuration(String kind, String band, long durationMs) {
        recordLatency("controlplane.task.duration", Duration.ofMillis(durationMs), "kind", kind, "band", band);
    }
    
    /**
     * Record an autoscale decision for a band.
     */
    public void recordScaling(String band, String direction, int liveExecutors) {
        incrementCounter("controlplane.workers.scaling", "band", band, "direction", direction);
        log.debug("Recorded scaling {} on band {} (live={})", direction, band, liveExecutors);
    }
    
    /**
     * Record measurements written by a metering task.
     */
    public void recordMeasurements(String type, int count) {
        counters.computeIfAbsent("controlplane.measurements." + type, k ->
            Counter.builder("controlplane.measurements.recorded")
                .tag("type", type)
                .register(meterRegistry))
            .increment(count);
    }
    
    /**
     * Record a scheduled firing.
     */
    public void recordScheduleFiring(String schedule, int tasks) {
        incrementCounter("controlplane.schedule.firings", "schedule", schedule);
        log.debug("Recorded firing of {} ({} tasks)", schedule, tasks);
    }
    
    /**
     * Record circuit breaker state change.
     */
    public void recordCircuitBreakerStateChange(String system, String state) {
        incrementCounter("controlplane.circuitbreaker.state", "system", system, "state", state);
    }
}
