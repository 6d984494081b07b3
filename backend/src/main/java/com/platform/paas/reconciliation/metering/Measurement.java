package com.platform.paas.reconciliation.metering;

import java.time.Instant;

/**
 * One usage sample. {@code key} identifies the sample across re-runs of the same period:
 * type, tenant, app, the measured subject (workload, volume, resource or namespace) and period start.
 */
public record Measurement(
    String key,
    String type,
    String tenantId,
    String appId,
    String name,
    String unit,
    long usage,
    Instant periodStart,
    Instant measuredAt
) {
    
    public static Measurement of(
            String type,
            String tenantId,
            String appId,
            String subject,
            String name,
            String unit,
            long usage,
            Instant periodStart,
            Instant measuredAt) {
        String key = String.join(":", type, tenantId, appId, subject, String.valueOf(periodStart.getEpochSecond()));
        return new Measurement(key, type, tenantId, appId, name, unit, usage, periodStart, measuredAt);
    }
}
