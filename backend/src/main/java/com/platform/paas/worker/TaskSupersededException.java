package com.platform.paas.worker;

import com.platform.paas.error.ControlPlaneException;
import com.platform.paas.error.ErrorCode;
import com.platform.paas.queue.GenerationStamp;

/**
 * Raised at a checkpoint when a newer firing of the task's schedule has started.
 */
public class TaskSupersededException extends ControlPlaneException {
    
    private final GenerationStamp stamp;
    private final long currentGeneration;
    
    public TaskSupersededException(GenerationStamp stamp, long currentGeneration) {
        super(ErrorCode.TASK_SUPERSEDED,
            String.format("Generation %d of %s superseded by %d", stamp.generation(), stamp.schedule(), currentGeneration));
        this.stamp = stamp;
        this.currentGeneration = currentGeneration;
    }
    
    public GenerationStamp getStamp() {
        return stamp;
    }
    
    public long getCurrentGeneration() {
        return currentGeneration;
    }
}
