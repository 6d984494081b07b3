package com.platform.paas.lifecycle;

import com.platform.paas.catalog.LimitCatalog;
import com.platform.paas.config.ControllerConfiguration;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * UP once the limit catalog is loaded.
 */
@Component
public class LimitCatalogHealthIndicator implements HealthIndicator {
    
    private final ControllerConfiguration configuration;
    
    public LimitCatalogHealthIndicator(ControllerConfiguration configuration) {
        this.configuration = configuration;
    }
    
    @Override
    public Health health() {
        LimitCatalog catalog = configuration.catalog();
        if (catalog == null || catalog.planCount() == 0) {
            return Health.down().withDetail("reason", "limit catalog not loaded").build();
        }
        return Health.up()
            .withDetail("plans", catalog.planCount())
            .withDetail("specs", catalog.specCount())
            .withDetail("defaultPlan", catalog.defaultPlan().id())
            .withDetail("loadedAt", configuration.loadedAt().toString())
            .build();
    }
}
