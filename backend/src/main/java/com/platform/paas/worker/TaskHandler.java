package com.platform.paas.worker;

import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;

/**
 * Executes one kind of reconciliation task.
 *
 * <p>Implementations must be idempotent: a task may be delivered more than once.
 * They signal retryable problems with {@link HandlerTransientException}, permanent ones with
 * {@link HandlerFatalException}, and call {@link TaskContext#checkpoint()} before every write.
 */
public interface TaskHandler {
    
    TaskKind kind();
    
    void handle(ReconciliationTask task, TaskContext context);
}
