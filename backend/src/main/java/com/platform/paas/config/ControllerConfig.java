package com.platform.paas.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

/**
 * Startup wiring for the immutable controller configuration.
 */
@Configuration
public class ControllerConfig {
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public ControllerConfiguration controllerConfiguration(
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${controlplane.catalog.limit-specs:}") String limitSpecs,
            @Value("${controlplane.catalog.limit-plans:}") String limitPlans,
            @Value("${controlplane.catalog.default-plan:}") String defaultPlan,
            @Value("${controlplane.admission.reserved-names:}") String reservedNames,
            @Value("${controlplane.admission.reserved-name-patterns:}") String reservedNamePatterns,
            @Value("${controlplane.templates.secret:}") String secretTemplate,
            @Value("${controlplane.templates.volume:}") String volumeTemplate,
            @Value("${controlplane.templates.volume-claim:}") String volumeClaimTemplate) {
        
        ControllerConfigurationLoader loader = new ControllerConfigurationLoader(resourceLoader, objectMapper, clock);
        return loader.load(new ControllerConfigurationLoader.Sources(
            limitSpecs,
            limitPlans,
            defaultPlan,
            reservedNames,
            reservedNamePatterns,
            secretTemplate,
            volumeTemplate,
            volumeClaimTemplate
        ));
    }
}
