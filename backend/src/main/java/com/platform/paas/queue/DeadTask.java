package com.platform.paas.queue;

import java.time.Instant;

/**
 * A task that exhausted its attempts or failed fatally.
 */
public record DeadTask(ReconciliationTask task, String reason, boolean fatal, Instant diedAt) {
}
