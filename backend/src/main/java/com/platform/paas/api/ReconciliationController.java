package com.platform.paas.api;

import com.platform.paas.error.ValidationException;
import com.platform.paas.queue.Band;
import com.platform.paas.queue.DeadTask;
import com.platform.paas.queue.QueueStats;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.queue.TaskScope;
import com.platform.paas.schedule.PeriodicSchedule;
import com.platform.paas.schedule.ScheduledTrigger;
import com.platform.paas.worker.WorkerPoolManager;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the reconciliation queue, its dead tasks and the periodic schedules.
 */
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {
    
    private final ReconciliationQueue queue;
    private final WorkerPoolManager workerPools;
    private final ScheduledTrigger trigger;
    
    public ReconciliationController(
            ReconciliationQueue queue,
            WorkerPoolManager workerPools,
            ScheduledTrigger trigger) {
        this.queue = queue;
        this.workerPools = workerPools;
        this.trigger = trigger;
    }
    
    @GetMapping("/queue")
    public QueueOverview getQueue() {
        return new QueueOverview(queue.stats(), workerPools.status());
    }
    
    @GetMapping("/dead-tasks")
    public List<DeadTask> getDeadTasks() {
        return queue.deadTasks();
    }
    
    @PostMapping("/dead-tasks/{taskId}/retry")
    public ReconciliationTask retryDeadTask(@PathVariable String taskId) {
        return queue.retryDead(taskId);
    }
    
    @PostMapping("/fire/{schedule}")
    public ScheduledTrigger.Firing fire(@PathVariable String schedule) {
        PeriodicSchedule periodic;
        try {
            periodic = PeriodicSchedule.fromId(schedule);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("schedule", schedule, e.getMessage());
        }
        return trigger.fire(periodic);
    }
    
    /**
     * Enqueue a high-band sync for everything, one tenant, or one app.
     */
    @PostMapping("/sync")
    public ReconciliationTask triggerSync(
            @RequestParam(required = false) String tenantId,
            @RequestParam(required = false) String appId) {
        TaskScope scope;
        if (tenantId == null && appId == null) {
            scope = TaskScope.all();
        } else if (appId == null) {
            scope = TaskScope.tenant(tenantId);
        } else if (tenantId != null) {
            scope = TaskScope.app(tenantId, appId);
        } else {
            throw new ValidationException("tenantId", null, "tenantId is required when appId is given");
        }
        return queue.enqueue(ReconciliationTask.of(TaskKind.SYNC_STATE, scope));
    }
    
    public record QueueOverview(QueueStats queue, Map<Band, WorkerPoolManager.PoolStatus> workers) {}
}
