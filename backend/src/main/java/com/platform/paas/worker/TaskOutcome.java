package com.platform.paas.worker;

/**
 * How a worker settled a task it executed.
 */
public enum TaskOutcome {
    SUCCEEDED,
    RETRY_SCHEDULED,
    DEAD,
    ABANDONED,
    IGNORED
}
