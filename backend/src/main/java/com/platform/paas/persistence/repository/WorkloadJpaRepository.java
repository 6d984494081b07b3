package com.platform.paas.persistence.repository;

import com.platform.paas.persistence.entity.WorkloadEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for desired workloads.
 */
@Repository
public interface WorkloadJpaRepository extends JpaRepository<WorkloadEntity, String> {
    
    List<WorkloadEntity> findByTenantId(String tenantId);
    
    List<WorkloadEntity> findByTenantIdAndAppId(String tenantId, String appId);
}
