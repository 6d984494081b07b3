package com.platform.paas.worker;

import com.platform.paas.observability.LoggingConfig;
import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.queue.Band;
import com.platform.paas.queue.NackOutcome;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.schedule.ScheduleGenerations;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors draining one band of the reconciliation queue.
 * 
 * Each executor loops: dequeue, run the handler under the band's timeout, settle the task.
 * - Success acks
 * - Transient errors, unexpected throwables and timeouts nack (retry with backoff)
 * - Fatal errors and missing handlers fail (dead immediately)
 * - Superseded generations abandon
 * 
 * The executor count follows {@link #resize(int)}; surplus executors retire after their
 * current task, never mid-execution.
 */
@Slf4j
public class BandWorkerPool {
    
    private final Band band;
    private final WorkerPoolProperties.BandSettings settings;
    private final Duration pollTimeout;
    private final ReconciliationQueue queue;
    private final TaskHandlerRegistry handlers;
    private final ScheduleGenerations generations;
    private final MetricsRegistry metricsRegistry;
    private final ExecutorService loopExecutor;
    private final ExecutorService handlerExecutor;
    
    private final AtomicInteger live = new AtomicInteger();
    private final AtomicInteger busy = new AtomicInteger();
    private final AtomicInteger target = new AtomicInteger();
    private volatile boolean running;
    private volatile boolean draining;
    
    public BandWorkerPool(
            Band band,
            WorkerPoolProperties.BandSettings settings,
            Duration pollTimeout,
            ReconciliationQueue queue,
            TaskHandlerRegistry handlers,
            ScheduleGenerations generations,
            MetricsRegistry metricsRegistry) {
        this.band = band;
        this.settings = settings;
        this.pollTimeout = pollTimeout;
        this.queue = queue;
        this.handlers = handlers;
        this.generations = generations;
        this.metricsRegistry = metricsRegistry;
        this.loopExecutor = Executors.newCachedThreadPool(new CustomizableThreadFactory("worker-" + band.tag() + "-"));
        this.handlerExecutor = Executors.newCachedThreadPool(new CustomizableThreadFactory("task-" + band.tag() + "-"));
        
        metricsRegistry.registerGauge("controlplane.workers.live", "Live executors per band",
            live::get, "band", band.tag());
        metricsRegistry.registerGauge("controlplane.workers.busy", "Executors running a task per band",
            busy::get, "band", band.tag());
    }
    
    /**
     * Start the band with its minimum executor count.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        resize(settings.getMin());
        log.info("Worker pool {} started ({}..{} executors, timeout {})",
            band.tag(), settings.getMin(), settings.getMax(), settings.getTimeout());
    }
    
    /**
     * Set the desired executor count, clamped to the band's bounds.
     * New executors start immediately; surplus ones retire when next idle.
     */
    public synchronized void resize(int desired) {
        if (!running || draining) {
            return;
        }
        int clamped = Math.max(settings.getMin(), Math.min(settings.getMax(), desired));
        target.set(clamped);
        while (live.get() < clamped) {
            live.incrementAndGet();
            loopExecutor.execute(this::runLoop);
        }
    }
    
    /**
     * Let executors finish the band's remaining ready work, then stop them.
     * Anything still running after {@code timeout} is interrupted.
     *
     * @return true if every executor finished within the timeout
     */
    public boolean drain(Duration timeout) throws InterruptedException {
        synchronized (this) {
            draining = true;
        }
        loopExecutor.shutdown();
        boolean drained = loopExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        running = false;
        if (!drained) {
            log.warn("Worker pool {} did not drain within {}, interrupting {} executor(s)",
                band.tag(), timeout, live.get());
            loopExecutor.shutdownNow();
        }
        handlerExecutor.shutdownNow();
        return drained;
    }
    
    public Band band() {
        return band;
    }
    
    public int liveExecutors() {
        return live.get();
    }
    
    public int busyExecutors() {
        return busy.get();
    }
    
    public int targetExecutors() {
        return target.get();
    }
    
    public boolean isRunning() {
        return running;
    }
    
    private void runLoop() {
        boolean retired = false;
        try {
            while (running) {
                if (retireIfSurplus()) {
                    retired = true;
                    return;
                }
                Optional<ReconciliationTask> task = queue.dequeue(band, pollTimeout);
                if (task.isPresent()) {
                    execute(task.get());
                } else if (draining) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Executor on {} interrupted", band.tag());
        } catch (RuntimeException e) {
            log.error("Executor loop on {} failed: {}", band.tag(), e.getMessage(), e);
        } finally {
            if (!retired) {
                live.decrementAndGet();
            }
        }
    }
    
    private boolean retireIfSurplus() {
        while (true) {
            int current = live.get();
            if (current <= target.get()) {
                return false;
            }
            if (live.compareAndSet(current, current - 1)) {
                log.debug("Executor on {} retired ({} live)", band.tag(), current - 1);
                return true;
            }
        }
    }
    
    /**
     * Run a claimed task and settle it with the queue.
     */
    TaskOutcome execute(ReconciliationTask task) {
        LoggingConfig.setTaskContext(task);
        busy.incrementAndGet();
        long startTime = System.currentTimeMillis();
        try {
            if (generations.isSuperseded(task.stamp())) {
                return queue.abandon(task, "superseded before start") ? TaskOutcome.ABANDONED : TaskOutcome.IGNORED;
            }
            
            Optional<TaskHandler> handler = handlers.find(task.kind());
            if (handler.isEmpty()) {
                return queue.fail(task, "No handler for task kind " + task.kind()) ? TaskOutcome.DEAD : TaskOutcome.IGNORED;
            }
            
            Future<?> future = handlerExecutor.submit(withMdc(() ->
                handler.get().handle(task, new TaskContext(task, generations))));
            try {
                future.get(settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                return nack(task, "Timed out after " + settings.getTimeout());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return nack(task, "Executor interrupted");
            } catch (ExecutionException e) {
                return settleFailure(task, e.getCause());
            }
            
            log.debug("Task {} ({}) completed", task.id(), task.kind());
            return queue.ack(task) ? TaskOutcome.SUCCEEDED : TaskOutcome.IGNORED;
            
        } finally {
            busy.decrementAndGet();
            metricsRegistry.recordTaskDuration(task.kind().wireName(), band.tag(),
                System.currentTimeMillis() - startTime);
            LoggingConfig.clearTaskContext();
        }
    }
    
    private TaskOutcome settleFailure(ReconciliationTask task, Throwable cause) {
        if (cause instanceof TaskSupersededException superseded) {
            return queue.abandon(task, superseded.getMessage()) ? TaskOutcome.ABANDONED : TaskOutcome.IGNORED;
        }
        if (cause instanceof HandlerFatalException) {
            log.error("Task {} ({}) failed permanently: {}", task.id(), task.kind(), cause.getMessage(), cause);
            return queue.fail(task, cause.getMessage()) ? TaskOutcome.DEAD : TaskOutcome.IGNORED;
        }
        if (!(cause instanceof HandlerTransientException)) {
            log.error("Task {} ({}) raised {}", task.id(), task.kind(), cause.getClass().getName(), cause);
        }
        return nack(task, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }
    
    private TaskOutcome nack(ReconciliationTask task, String reason) {
        NackOutcome outcome = queue.nack(task, reason);
        return switch (outcome) {
            case RETRY_SCHEDULED -> TaskOutcome.RETRY_SCHEDULED;
            case DEAD -> TaskOutcome.DEAD;
            case IGNORED -> TaskOutcome.IGNORED;
        };
    }
    
    private static Runnable withMdc(Runnable runnable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                runnable.run();
            } finally {
                MDC.clear();
            }
        };
    }
}
