package com.platform.paas.queue;

/**
 * Marks a task as produced by a particular firing of a named schedule.
 */
public record GenerationStamp(String schedule, long generation) {
    
    @Override
    public String toString() {
        return schedule + "#" + generation;
    }
}
