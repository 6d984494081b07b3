package com.platform.paas.lifecycle;

import com.platform.paas.worker.WorkerPoolManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the worker pools once the context is fully initialized, then marks the controller ready.
 */
@Slf4j
@Component
public class ApplicationStartupListener {
    
    private final ApplicationLifecycleManager lifecycleManager;
    private final WorkerPoolManager workerPools;
    
    public ApplicationStartupListener(ApplicationLifecycleManager lifecycleManager, WorkerPoolManager workerPools) {
        this.lifecycleManager = lifecycleManager;
        this.workerPools = workerPools;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        log.info("Application startup complete, starting worker pools");
        workerPools.start();
        lifecycleManager.markReady();
    }
}
