package com.platform.paas.persistence.repository;

import com.platform.paas.persistence.entity.ServiceResourceEntity;
import com.platform.paas.persistence.entity.ServiceResourceEntity.BindingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for service resources.
 */
@Repository
public interface ServiceResourceJpaRepository extends JpaRepository<ServiceResourceEntity, String> {
    
    List<ServiceResourceEntity> findByStatus(BindingStatus status);
    
    List<ServiceResourceEntity> findByStatusAndTenantId(BindingStatus status, String tenantId);
    
    List<ServiceResourceEntity> findByStatusAndTenantIdAndAppId(BindingStatus status, String tenantId, String appId);
}
