package com.platform.paas.queue;

/**
 * What the queue did with a negatively acknowledged task.
 */
public enum NackOutcome {
    RETRY_SCHEDULED,
    DEAD,
    IGNORED
}
