package com.platform.paas.queue;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit of reconciliation work.
 *
 * <p>Instances are immutable. The queue assigns {@code enqueuedAt} and {@code sequence}
 * on acceptance, a fresh {@code delivery} token each time the task is claimed, and
 * derives new instances on each failed attempt. Settling a task only takes effect
 * while its delivery token still matches the current claim.
 */
public record ReconciliationTask(
    String id,
    TaskKind kind,
    Band band,
    TaskScope scope,
    GenerationStamp stamp,
    Instant enqueuedAt,
    long sequence,
    int attempts,
    Instant notBefore,
    String lastError,
    long delivery
) {
    
    public static ReconciliationTask of(TaskKind kind, TaskScope scope) {
        return of(kind, kind.defaultBand(), scope, null);
    }
    
    public static ReconciliationTask of(TaskKind kind, Band band, TaskScope scope, GenerationStamp stamp) {
        return new ReconciliationTask(
            UUID.randomUUID().toString(),
            kind,
            band,
            scope == null ? TaskScope.all() : scope,
            stamp,
            null,
            0,
            0,
            null,
            null,
            0
        );
    }
    
    public ReconciliationTask withEnqueue(Instant at, long seq) {
        return new ReconciliationTask(id, kind, band, scope, stamp, at, seq, attempts, notBefore, lastError, delivery);
    }
    
    public ReconciliationTask withDelivery(long token) {
        return new ReconciliationTask(id, kind, band, scope, stamp, enqueuedAt, sequence, attempts, notBefore,
            lastError, token);
    }
    
    public ReconciliationTask withFailure(String reason, Instant retryAt) {
        return new ReconciliationTask(id, kind, band, scope, stamp, enqueuedAt, sequence,
            attempts + 1, retryAt, reason, delivery);
    }
    
    public ReconciliationTask withAttemptsReset() {
        return new ReconciliationTask(id, kind, band, scope, stamp, enqueuedAt, sequence, 0, null, null, delivery);
    }
    
    public boolean isStamped() {
        return stamp != null;
    }
    
    public boolean isReady(Instant now) {
        return notBefore == null || !notBefore.isAfter(now);
    }
}
