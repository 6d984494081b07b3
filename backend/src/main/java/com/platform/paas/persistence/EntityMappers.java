package com.platform.paas.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.paas.admission.ContainerResources;
import com.platform.paas.admission.RewrittenRequest;
import com.platform.paas.admission.VolumeRequest;
import com.platform.paas.admission.WorkloadDescriptor;
import com.platform.paas.persistence.entity.MeasurementEntity;
import com.platform.paas.persistence.entity.ServiceResourceEntity;
import com.platform.paas.persistence.entity.WorkloadEntity;
import com.platform.paas.reconciliation.BoundResource;
import com.platform.paas.reconciliation.DesiredWorkload;
import com.platform.paas.reconciliation.metering.Measurement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bidirectional mappers between domain objects and JPA entities.
 */
@Slf4j
@Component
public class EntityMappers {
    
    private static final TypeReference<List<ContainerResources>> CONTAINERS_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<VolumeRequest>> VOLUMES_TYPE = new TypeReference<>() {};
    
    private final ObjectMapper objectMapper;
    
    public EntityMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    // ==================== Workload ====================
    
    public WorkloadEntity toEntity(RewrittenRequest request) {
        WorkloadDescriptor workload = request.workload();
        return WorkloadEntity.builder()
            .id(WorkloadEntity.idOf(request.tenantId(), workload.appId(), workload.name()))
            .tenantId(request.tenantId())
            .appId(workload.appId())
            .name(workload.name())
            .planId(request.planId())
            .replicas(workload.replicaCount())
            .containersJson(write(workload.containers()))
            .volumesJson(write(workload.volumes()))
            .build();
    }
    
    public DesiredWorkload toDomain(WorkloadEntity entity) {
        WorkloadDescriptor workload = new WorkloadDescriptor(
            entity.getAppId(),
            entity.getName(),
            entity.getReplicas(),
            read(entity.getContainersJson(), CONTAINERS_TYPE),
            read(entity.getVolumesJson(), VOLUMES_TYPE)
        );
        return new DesiredWorkload(entity.getTenantId(), entity.getPlanId(), workload, entity.getUpdatedAt());
    }
    
    // ==================== ServiceResource ====================
    
    public BoundResource toDomain(ServiceResourceEntity entity) {
        return new BoundResource(entity.getTenantId(), entity.getAppId(), entity.getName(), entity.getPlan());
    }
    
    // ==================== Measurement ====================
    
    public MeasurementEntity toEntity(Measurement measurement, String taskId) {
        return MeasurementEntity.builder()
            .id(measurement.key())
            .type(measurement.type())
            .tenantId(measurement.tenantId())
            .appId(measurement.appId())
            .name(measurement.name())
            .unit(measurement.unit())
            .usage(measurement.usage())
            .periodStart(measurement.periodStart())
            .measuredAt(measurement.measuredAt())
            .taskId(taskId)
            .build();
    }
    
    // ==================== JSON Helpers ====================
    
    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("Failed to serialize workload state", e);
        }
    }
    
    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize workload state: {}", json, e);
            throw new IllegalStateException("Failed to deserialize workload state", e);
        }
    }
}
