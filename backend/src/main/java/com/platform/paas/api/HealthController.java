package com.platform.paas.api;

import com.platform.paas.core.CircuitBreakerManager;
import com.platform.paas.lifecycle.ApplicationLifecycleManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Liveness and readiness probes for the admission listener, plus breaker states.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {
    
    private final ApplicationLifecycleManager lifecycleManager;
    private final CircuitBreakerManager circuitBreakerManager;
    
    /**
     * Simple liveness probe.
     */
    @GetMapping("/healthz")
    public ResponseEntity<Map<String, String>> liveness() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
    
    /**
     * Readiness probe: the limit catalog must be loaded and the queue accepting work.
     */
    @GetMapping("/readiness")
    public ResponseEntity<Map<String, Object>> readiness() {
        List<String> problems = lifecycleManager.readinessProblems();
        if (problems.isEmpty()) {
            return ResponseEntity.ok(Map.of(
                "status", "UP",
                "phase", lifecycleManager.getCurrentPhase().name()
            ));
        }
        return ResponseEntity.status(503).body(Map.of(
            "status", "DOWN",
            "phase", lifecycleManager.getCurrentPhase().name(),
            "reasons", problems
        ));
    }
    
    @GetMapping("/api/health/lifecycle")
    public ResponseEntity<ApplicationLifecycleManager.LifecycleStatus> lifecycle() {
        return ResponseEntity.ok(lifecycleManager.getStatus());
    }
    
    /**
     * Get all circuit breaker states.
     */
    @GetMapping("/api/health/circuit-breakers")
    public ResponseEntity<Map<String, CircuitBreakerManager.CircuitBreakerStatus>> getCircuitBreakers() {
        return ResponseEntity.ok(circuitBreakerManager.getAllStates());
    }
    
    @GetMapping("/api/health/circuit-breakers/{system}")
    public ResponseEntity<CircuitBreakerManager.CircuitBreakerStatus> getCircuitBreaker(
            @PathVariable String system) {
        CircuitBreakerManager.CircuitBreakerStatus status =
            circuitBreakerManager.getAllStates().get(system.toLowerCase());
        if (status == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(status);
    }
}
