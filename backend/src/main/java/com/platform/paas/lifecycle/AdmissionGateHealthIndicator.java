package com.platform.paas.lifecycle;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health of the admission listener: DOWN whenever a request arriving now would be
 * refused for reasons other than its own content.
 */
@Component
public class AdmissionGateHealthIndicator implements HealthIndicator {
    
    private final ApplicationLifecycleManager lifecycleManager;
    
    public AdmissionGateHealthIndicator(ApplicationLifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }
    
    @Override
    public Health health() {
        List<String> problems = lifecycleManager.readinessProblems();
        if (!problems.isEmpty()) {
            return Health.down().withDetail("problems", problems).build();
        }
        return Health.up()
            .withDetail("phase", lifecycleManager.getCurrentPhase().name())
            .build();
    }
}
