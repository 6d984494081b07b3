package com.platform.paas.lifecycle;

import com.platform.paas.config.ControllerConfiguration;
import com.platform.paas.queue.ReconciliationQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.LivenessState;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Application lifecycle state manager.
 * 
 * Tracks application phases:
 * - STARTING: configuration loaded, pools not yet running
 * - READY: pools running, admissions accepted
 * - DRAINING: shutdown initiated, queue closed, pools finishing
 * - STOPPED: pools stopped
 * 
 * Readiness additionally requires a loaded limit catalog and an open queue.
 */
@Slf4j
@Component
public class ApplicationLifecycleManager {
    
    private final ApplicationEventPublisher eventPublisher;
    private final ControllerConfiguration configuration;
    private final ReconciliationQueue queue;
    private final AtomicReference<LifecyclePhase> currentPhase = new AtomicReference<>(LifecyclePhase.STARTING);
    private volatile Instant phaseStartTime = Instant.now();
    
    public ApplicationLifecycleManager(
            ApplicationEventPublisher eventPublisher,
            ControllerConfiguration configuration,
            ReconciliationQueue queue) {
        this.eventPublisher = eventPublisher;
        this.configuration = configuration;
        this.queue = queue;
    }
    
    /**
     * Mark application as ready.
     */
    public void markReady() {
        if (currentPhase.compareAndSet(LifecyclePhase.STARTING, LifecyclePhase.READY)) {
            phaseStartTime = Instant.now();
            log.info("Controller marked READY (catalog: {} plans, {} specs)",
                configuration.catalog().planCount(), configuration.catalog().specCount());
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.ACCEPTING_TRAFFIC);
        }
    }
    
    /**
     * Start draining (pre-shutdown).
     */
    public void startDraining() {
        LifecyclePhase previous = currentPhase.getAndSet(LifecyclePhase.DRAINING);
        if (previous != LifecyclePhase.DRAINING) {
            phaseStartTime = Instant.now();
            log.info("Controller entering DRAINING phase (was {})", previous);
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.REFUSING_TRAFFIC);
        }
    }
    
    /**
     * Mark as stopped.
     */
    public void markStopped() {
        LifecyclePhase previous = currentPhase.getAndSet(LifecyclePhase.STOPPED);
        phaseStartTime = Instant.now();
        log.info("Controller marked STOPPED (was {})", previous);
        AvailabilityChangeEvent.publish(eventPublisher, this, LivenessState.BROKEN);
    }
    
    public LifecyclePhase getCurrentPhase() {
        return currentPhase.get();
    }
    
    public boolean isReady() {
        return readinessProblems().isEmpty();
    }
    
    /**
     * Reasons the controller cannot admit work right now; empty when ready.
     */
    public List<String> readinessProblems() {
        List<String> problems = new ArrayList<>();
        if (configuration == null || configuration.catalog().planCount() == 0) {
            problems.add("limit catalog not loaded");
        }
        if (!queue.isAvailable()) {
            problems.add("reconciliation queue closed");
        }
        if (currentPhase.get() != LifecyclePhase.READY) {
            problems.add("lifecycle phase " + currentPhase.get());
        }
        return problems;
    }
    
    public LifecycleStatus getStatus() {
        return new LifecycleStatus(
            currentPhase.get(),
            phaseStartTime,
            Instant.now().toEpochMilli() - phaseStartTime.toEpochMilli()
        );
    }
    
    public enum LifecyclePhase {
        STARTING,
        READY,
        DRAINING,
        STOPPED
    }
    
    public record LifecycleStatus(
        LifecyclePhase phase,
        Instant phaseStartTime,
        long durationMs
    ) {}
}
