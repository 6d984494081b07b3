package com.platform.paas.schedule;

import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.queue.GenerationStamp;
import com.platform.paas.queue.QueueUnavailableException;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.queue.TaskScope;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Enqueues periodic reconciliation work.
 * 
 * Every firing starts a new generation of its schedule and stamps the tasks it enqueues
 * with it. Tasks of an older generation that are still queued or running are abandoned by
 * the workers at their next checkpoint, so a new firing replaces a slow previous one instead
 * of queueing behind it.
 */
@Slf4j
@Component
public class ScheduledTrigger {
    
    private final ReconciliationQueue queue;
    private final ScheduleGenerations generations;
    private final MetricsRegistry metricsRegistry;
    
    @Value("${controlplane.schedule.enabled:true}")
    private boolean enabled = true;
    
    private volatile boolean stopped;
    
    public ScheduledTrigger(
            ReconciliationQueue queue,
            ScheduleGenerations generations,
            MetricsRegistry metricsRegistry) {
        this.queue = queue;
        this.generations = generations;
        this.metricsRegistry = metricsRegistry;
    }
    
    @Scheduled(cron = "${controlplane.schedule.hourly-cron:0 0 * * * *}", zone = "${controlplane.schedule.zone:UTC}")
    public void fireHourly() {
        if (enabled) {
            fire(PeriodicSchedule.HOURLY);
        }
    }
    
    @Scheduled(cron = "${controlplane.schedule.daily-cron:0 0 1 * * *}", zone = "${controlplane.schedule.zone:UTC}")
    public void fireDaily() {
        if (enabled) {
            fire(PeriodicSchedule.DAILY);
        }
    }
    
    /**
     * Start a new generation of a schedule and enqueue its tasks.
     * Kinds the queue refuses are reported as skipped; the next firing covers them.
     */
    public Firing fire(PeriodicSchedule schedule) {
        if (stopped) {
            log.info("Trigger stopped, skipping {} firing", schedule.id());
            return new Firing(schedule.id(), generations.current(schedule.id()), List.of(), schedule.kinds());
        }
        
        long generation = generations.advance(schedule.id());
        GenerationStamp stamp = new GenerationStamp(schedule.id(), generation);
        MDC.put("schedule", schedule.id());
        MDC.put("generation", String.valueOf(generation));
        try {
            List<String> taskIds = new ArrayList<>();
            List<TaskKind> skipped = new ArrayList<>();
            for (TaskKind kind : schedule.kinds()) {
                try {
                    ReconciliationTask accepted = queue.enqueue(
                        ReconciliationTask.of(kind, schedule.bandFor(kind), TaskScope.all(), stamp));
                    taskIds.add(accepted.id());
                } catch (QueueUnavailableException e) {
                    log.warn("Could not enqueue {} for {}: {}", kind, stamp, e.getMessage());
                    skipped.add(kind);
                }
            }
            metricsRegistry.recordScheduleFiring(schedule.id(), taskIds.size());
            log.info("Fired {} generation {}: {} task(s) enqueued, {} skipped",
                schedule.id(), generation, taskIds.size(), skipped.size());
            return new Firing(schedule.id(), generation, taskIds, skipped);
        } finally {
            MDC.remove("schedule");
            MDC.remove("generation");
        }
    }
    
    /**
     * Stop producing work. Already enqueued tasks are unaffected.
     */
    public void stop() {
        stopped = true;
        log.info("Scheduled trigger stopped");
    }
    
    public boolean isStopped() {
        return stopped;
    }
    
    public record Firing(String schedule, long generation, List<String> taskIds, List<TaskKind> skipped) {}
}
