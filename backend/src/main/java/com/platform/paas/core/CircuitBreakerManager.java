package com.platform.paas.core;

import com.platform.paas.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Manages circuit breakers for the cluster API and the broker.
 */
@Slf4j
@Component
public class CircuitBreakerManager {
    
    public static final String KUBERNETES = "kubernetes";
    public static final String KAFKA = "kafka";
    
    private static final List<String> SYSTEMS = List.of(KUBERNETES, KAFKA);
    
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final MetricsRegistry metricsRegistry;
    
    public CircuitBreakerManager(
            CircuitBreakerRegistry circuitBreakerRegistry,
            MetricsRegistry metricsRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.metricsRegistry = metricsRegistry;
    }
    
    @PostConstruct
    public void init() {
        for (String system : SYSTEMS) {
            registerEventListeners(circuitBreakerRegistry.circuitBreaker(system), system);
        }
        log.info("CircuitBreakerManager initialized for {}", SYSTEMS);
    }
    
    private void registerEventListeners(CircuitBreaker circuitBreaker, String system) {
        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> {
                String toState = event.getStateTransition().getToState().name();
                log.info("Circuit breaker {} state change: {} -> {}",
                    system, event.getStateTransition().getFromState(), toState);
                metricsRegistry.recordCircuitBreakerStateChange(system, toState);
            })
            .onError(event -> log.debug("Circuit breaker {} recorded error: {}",
                system, event.getThrowable().getMessage()));
    }
    
    /**
     * Run a call through the breaker of an external system.
     *
     * @throws io.github.resilience4j.circuitbreaker.CallNotPermittedException if the breaker is open
     */
    public <T> T execute(String system, Supplier<T> call) {
        return circuitBreakerRegistry.circuitBreaker(system).executeSupplier(call);
    }
    
    public void execute(String system, Runnable call) {
        circuitBreakerRegistry.circuitBreaker(system).executeRunnable(call);
    }
    
    /**
     * Get circuit breaker state for a system.
     */
    public String getState(String system) {
        return circuitBreakerRegistry.circuitBreaker(system).getState().name();
    }
    
    /**
     * Get all circuit breaker states.
     */
    public Map<String, CircuitBreakerStatus> getAllStates() {
        Map<String, CircuitBreakerStatus> states = new LinkedHashMap<>();
        for (String system : SYSTEMS) {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(system);
            CircuitBreaker.Metrics metrics = cb.getMetrics();
            states.put(system, new CircuitBreakerStatus(
                cb.getState().name(),
                metrics.getNumberOfSuccessfulCalls(),
                metrics.getNumberOfFailedCalls(),
                metrics.getFailureRate()
            ));
        }
        return states;
    }
    
    /**
     * Reset circuit breaker (clear metrics and transition to closed).
     */
    public void reset(String system) {
        circuitBreakerRegistry.circuitBreaker(system).reset();
        log.info("Reset circuit breaker {}", system);
    }
    
    /**
     * Circuit breaker status record.
     */
    public record CircuitBreakerStatus(
        String state,
        int successfulCalls,
        int failedCalls,
        float failureRate
    ) {}
}
