package com.platform.paas.reconciliation.metering;

import com.platform.paas.connectors.kafka.MeasurementPublisher;
import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.persistence.EntityMappers;
import com.platform.paas.persistence.entity.MeasurementEntity;
import com.platform.paas.persistence.repository.MeasurementJpaRepository;
import com.platform.paas.worker.HandlerTransientException;
import com.platform.paas.worker.TaskContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Stores measurements and hands them to the broker.
 * 
 * Rows are keyed by measurement key, so a re-run overwrites instead of adding.
 * Nothing is written once the task's generation has been superseded.
 */
@Slf4j
@Component
public class MeasurementRecorder {
    
    private final MeasurementJpaRepository repository;
    private final EntityMappers entityMappers;
    private final MeasurementPublisher publisher;
    private final MetricsRegistry metricsRegistry;
    
    public MeasurementRecorder(
            MeasurementJpaRepository repository,
            EntityMappers entityMappers,
            MeasurementPublisher publisher,
            MetricsRegistry metricsRegistry) {
        this.repository = repository;
        this.entityMappers = entityMappers;
        this.publisher = publisher;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * @return number of measurements recorded
     * @throws HandlerTransientException if the store or the broker is unavailable
     */
    public int record(TaskContext context, String type, List<Measurement> measurements) {
        if (measurements.isEmpty()) {
            log.debug("No {} measurements to record", type);
            return 0;
        }
        
        context.checkpoint();
        List<MeasurementEntity> entities = measurements.stream()
            .map(m -> entityMappers.toEntity(m, context.task().id()))
            .toList();
        try {
            repository.saveAll(entities);
        } catch (DataAccessException e) {
            throw new HandlerTransientException("Failed to store " + type + " measurements: " + e.getMessage(), e);
        }
        
        try {
            publisher.publish(measurements);
        } catch (MeasurementPublisher.PublishException e) {
            throw new HandlerTransientException(e.getMessage(), e);
        }
        
        metricsRegistry.recordMeasurements(type, measurements.size());
        log.info("Recorded {} {} measurement(s)", measurements.size(), type);
        return measurements.size();
    }
}
