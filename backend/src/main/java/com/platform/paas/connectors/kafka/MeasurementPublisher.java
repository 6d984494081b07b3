package com.platform.paas.connectors.kafka;

import com.platform.paas.core.CircuitBreakerManager;
import com.platform.paas.error.ControlPlaneException;
import com.platform.paas.error.ErrorCode;
import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.reconciliation.metering.Measurement;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes stored measurements to the metering topic, keyed by measurement key.
 * Consumers see each measurement at least once and deduplicate on the key.
 */
@Slf4j
@Component
public class MeasurementPublisher {
    
    private final KafkaTemplate<String, Measurement> kafkaTemplate;
    private final CircuitBreakerManager circuitBreakers;
    private final MetricsRegistry metricsRegistry;
    
    @Value("${controlplane.kafka.measurement-topic:controlplane-measurements}")
    private String measurementTopic = "controlplane-measurements";
    
    @Value("${controlplane.kafka.send-timeout-seconds:30}")
    private int sendTimeoutSeconds = 30;
    
    public MeasurementPublisher(
            KafkaTemplate<String, Measurement> kafkaTemplate,
            CircuitBreakerManager circuitBreakers,
            MetricsRegistry metricsRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.circuitBreakers = circuitBreakers;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Send a batch and wait for every acknowledgement.
     *
     * @throws PublishException if any send fails or the kafka breaker is open
     */
    public void publish(List<Measurement> measurements) {
        if (measurements.isEmpty()) {
            return;
        }
        long startTime = System.currentTimeMillis();
        try {
            circuitBreakers.execute(CircuitBreakerManager.KAFKA, () -> sendAll(measurements));
        } catch (CallNotPermittedException e) {
            metricsRegistry.incrementCounter("kafka.measurements.failed", "reason", "circuit_open");
            throw new PublishException("Kafka circuit breaker open", e);
        }
        long latency = System.currentTimeMillis() - startTime;
        metricsRegistry.incrementCounter("kafka.measurements.published");
        log.debug("Published {} measurement(s) to {} in {}ms", measurements.size(), measurementTopic, latency);
    }
    
    private void sendAll(List<Measurement> measurements) {
        List<CompletableFuture<SendResult<String, Measurement>>> futures = new ArrayList<>();
        try {
            for (Measurement measurement : measurements) {
                futures.add(kafkaTemplate.send(measurementTopic, measurement.key(), measurement));
            }
        } catch (KafkaException e) {
            metricsRegistry.incrementCounter("kafka.measurements.failed", "reason", "send");
            throw new PublishException("Failed to send measurements: " + e.getMessage(), e);
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(sendTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("Interrupted while publishing measurements", e);
        } catch (ExecutionException | TimeoutException e) {
            metricsRegistry.incrementCounter("kafka.measurements.failed", "reason", "send");
            throw new PublishException("Failed to publish measurements: " + e.getMessage(), e);
        }
    }
    
    /**
     * Raised when measurements could not be handed to the broker.
     */
    public static class PublishException extends ControlPlaneException {
        
        public PublishException(String message, Throwable cause) {
            super(ErrorCode.KAFKA_UNAVAILABLE, message, cause);
        }
    }
}
