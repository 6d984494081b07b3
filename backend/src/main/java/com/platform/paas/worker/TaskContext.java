package com.platform.paas.worker;

import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.schedule.ScheduleGenerations;

/**
 * Execution context handed to a {@link TaskHandler}.
 */
public class TaskContext {
    
    private final ReconciliationTask task;
    private final ScheduleGenerations generations;
    
    public TaskContext(ReconciliationTask task, ScheduleGenerations generations) {
        this.task = task;
        this.generations = generations;
    }
    
    public ReconciliationTask task() {
        return task;
    }
    
    /**
     * Safe point before a write. Aborts the handler if its generation was superseded
     * or its execution was cancelled.
     *
     * @throws TaskSupersededException   if a newer firing of the task's schedule exists
     * @throws HandlerTransientException if the executing thread was interrupted
     */
    public void checkpoint() {
        if (Thread.currentThread().isInterrupted()) {
            throw new HandlerTransientException("Task " + task.id() + " was interrupted");
        }
        if (generations.isSuperseded(task.stamp())) {
            throw new TaskSupersededException(task.stamp(), generations.current(task.stamp().schedule()));
        }
    }
    
    public boolean isCurrent() {
        return !generations.isSuperseded(task.stamp());
    }
}
