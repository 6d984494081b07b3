package com.platform.paas.persistence.repository;

import com.platform.paas.persistence.entity.MeasurementEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for usage measurements.
 */
@Repository
public interface MeasurementJpaRepository extends JpaRepository<MeasurementEntity, String> {
    
    List<MeasurementEntity> findByTypeAndPeriodStart(String type, Instant periodStart);
    
    long countByType(String type);
}
