package com.platform.paas.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the desired state of one tenant workload.
 * The id is derived from tenant, app and workload name.
 */
@Entity
@Table(name = "workloads", indexes = {
    @Index(name = "idx_workloads_tenant_app", columnList = "tenant_id, app_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkloadEntity {
    
    @Id
    @Column(length = 255)
    private String id;
    
    @Column(name = "tenant_id", length = 63, nullable = false)
    private String tenantId;
    
    @Column(name = "app_id", length = 63, nullable = false)
    private String appId;
    
    @Column(length = 63, nullable = false)
    private String name;
    
    @Column(name = "plan_id", length = 63, nullable = false)
    private String planId;
    
    @Column(nullable = false)
    @Builder.Default
    private int replicas = 1;
    
    /**
     * Container resources as a JSON array.
     */
    @Column(name = "containers_json", length = 65535, nullable = false)
    private String containersJson;
    
    /**
     * Volume requests as a JSON array.
     */
    @Column(name = "volumes_json", length = 65535, nullable = false)
    private String volumesJson;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
    
    public static String idOf(String tenantId, String appId, String name) {
        return tenantId + "/" + appId + "/" + name;
    }
}
