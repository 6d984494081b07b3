package com.platform.paas.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for a service resource (database, cache, bucket) provisioned for an app.
 * Only bound resources are metered.
 */
@Entity
@Table(name = "service_resources")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceResourceEntity {
    
    @Id
    @Column(length = 36)
    private String id;
    
    @Column(name = "tenant_id", length = 63, nullable = false)
    private String tenantId;
    
    @Column(name = "app_id", length = 63, nullable = false)
    private String appId;
    
    @Column(length = 63, nullable = false)
    private String name;
    
    /**
     * Provider plan, e.g. {@code postgresql:standard-10}.
     */
    @Column(length = 128, nullable = false)
    private String plan;
    
    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    @Builder.Default
    private BindingStatus status = BindingStatus.UNBOUND;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
    
    public enum BindingStatus {
        BOUND,
        UNBOUND
    }
}
