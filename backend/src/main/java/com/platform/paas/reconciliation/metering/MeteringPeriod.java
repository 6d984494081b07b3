package com.platform.paas.reconciliation.metering;

import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.schedule.PeriodicSchedule;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Period a metering task measures. Derived from the task's enqueue time, which survives
 * retries and redelivery, so every attempt of a task writes the same period.
 */
public final class MeteringPeriod {
    
    private MeteringPeriod() {
    }
    
    public static Instant startOf(ReconciliationTask task) {
        Instant enqueuedAt = task.enqueuedAt();
        if (task.isStamped() && PeriodicSchedule.DAILY.id().equals(task.stamp().schedule())) {
            return enqueuedAt.truncatedTo(ChronoUnit.DAYS);
        }
        return enqueuedAt.truncatedTo(ChronoUnit.HOURS);
    }
}
