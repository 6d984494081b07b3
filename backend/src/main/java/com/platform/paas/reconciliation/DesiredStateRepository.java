package com.platform.paas.reconciliation;

import com.platform.paas.admission.RewrittenRequest;
import com.platform.paas.persistence.EntityMappers;
import com.platform.paas.persistence.entity.ServiceResourceEntity;
import com.platform.paas.persistence.entity.ServiceResourceEntity.BindingStatus;
import com.platform.paas.persistence.entity.WorkloadEntity;
import com.platform.paas.persistence.repository.ServiceResourceJpaRepository;
import com.platform.paas.persistence.repository.WorkloadJpaRepository;
import com.platform.paas.queue.TaskScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Repository for desired tenant state.
 * Delegates to JPA repositories for persistent storage.
 */
@Slf4j
@Component
public class DesiredStateRepository {
    
    private final WorkloadJpaRepository workloadRepository;
    private final ServiceResourceJpaRepository resourceRepository;
    private final EntityMappers entityMappers;
    
    public DesiredStateRepository(
            WorkloadJpaRepository workloadRepository,
            ServiceResourceJpaRepository resourceRepository,
            EntityMappers entityMappers) {
        this.workloadRepository = workloadRepository;
        this.resourceRepository = resourceRepository;
        this.entityMappers = entityMappers;
    }
    
    /**
     * Save an admitted workload, replacing any previous state for the same name.
     */
    public DesiredWorkload save(RewrittenRequest request) {
        WorkloadEntity entity = entityMappers.toEntity(request);
        workloadRepository.findById(entity.getId())
            .ifPresent(existing -> entity.setCreatedAt(existing.getCreatedAt()));
        WorkloadEntity saved = workloadRepository.save(entity);
        log.info("Saved desired state for {}", saved.getId());
        return entityMappers.toDomain(saved);
    }
    
    public Optional<DesiredWorkload> find(String tenantId, String appId, String name) {
        return workloadRepository.findById(WorkloadEntity.idOf(tenantId, appId, name))
            .map(entityMappers::toDomain);
    }
    
    /**
     * Desired workloads within a scope.
     */
    public List<DesiredWorkload> workloads(TaskScope scope) {
        List<WorkloadEntity> entities;
        if (scope.isAll()) {
            entities = workloadRepository.findAll();
        } else if (scope.appId() == null) {
            entities = workloadRepository.findByTenantId(scope.tenantId());
        } else if (scope.tenantId() == null) {
            entities = workloadRepository.findAll().stream()
                .filter(e -> scope.appId().equals(e.getAppId()))
                .toList();
        } else {
            entities = workloadRepository.findByTenantIdAndAppId(scope.tenantId(), scope.appId());
        }
        return entities.stream().map(entityMappers::toDomain).toList();
    }
    
    /**
     * Bound service resources within a scope.
     */
    public List<BoundResource> boundResources(TaskScope scope) {
        List<ServiceResourceEntity> entities = scope.tenantId() == null
            ? resourceRepository.findByStatus(BindingStatus.BOUND)
            : scope.appId() == null
                ? resourceRepository.findByStatusAndTenantId(BindingStatus.BOUND, scope.tenantId())
                : resourceRepository.findByStatusAndTenantIdAndAppId(BindingStatus.BOUND, scope.tenantId(), scope.appId());
        return entities.stream()
            .map(entityMappers::toDomain)
            .filter(r -> scope.includes(r.tenantId(), r.appId()))
            .toList();
    }
    
    /**
     * Delete desired state for a workload.
     */
    public boolean delete(String tenantId, String appId, String name) {
        String id = WorkloadEntity.idOf(tenantId, appId, name);
        if (workloadRepository.existsById(id)) {
            workloadRepository.deleteById(id);
            log.info("Deleted desired state for {}", id);
            return true;
        }
        return false;
    }
}
