package com.platform.paas.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for a usage measurement.
 * The id is the measurement key, so writing the same period twice overwrites one row.
 */
@Entity
@Table(name = "measurements", indexes = {
    @Index(name = "idx_measurements_type_period", columnList = "type, period_start")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementEntity {
    
    @Id
    @Column(length = 320)
    private String id;
    
    @Column(length = 32, nullable = false)
    private String type;
    
    @Column(name = "tenant_id", length = 63, nullable = false)
    private String tenantId;
    
    @Column(name = "app_id", length = 63, nullable = false)
    private String appId;
    
    @Column(length = 128, nullable = false)
    private String name;
    
    @Column(length = 16, nullable = false)
    private String unit;
    
    @Column(name = "usage_amount", nullable = false)
    private long usage;
    
    @Column(name = "period_start", nullable = false)
    private Instant periodStart;
    
    @Column(name = "measured_at", nullable = false)
    private Instant measuredAt;
    
    @Column(name = "task_id", length = 36)
    private String taskId;
}
