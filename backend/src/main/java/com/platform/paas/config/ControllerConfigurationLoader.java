package com.platform.paas.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.paas.admission.ReservedNamePolicy;
import com.platform.paas.catalog.LimitCatalog;
import com.platform.paas.catalog.LimitPlan;
import com.platform.paas.catalog.LimitSpec;
import com.platform.paas.error.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Reads limit specs, limit plans, name policy and templates from their configured
 * locations. Every source is optional: a blank or missing location falls back to the
 * built-in default under {@code classpath:defaults/}. A source that exists but cannot be
 * parsed is a fatal configuration error.
 */
@Slf4j
public class ControllerConfigurationLoader {
    
    static final String DEFAULT_LIMIT_SPECS = "classpath:defaults/limit-specs.json";
    static final String DEFAULT_LIMIT_PLANS = "classpath:defaults/limit-plans.json";
    static final String DEFAULT_RESERVED_PATTERNS = "classpath:defaults/reserved-name-patterns.txt";
    static final String DEFAULT_SECRET_TEMPLATE = "classpath:defaults/secret-template.json";
    static final String DEFAULT_VOLUME_TEMPLATE = "classpath:defaults/volume-template.json";
    static final String DEFAULT_VOLUME_CLAIM_TEMPLATE = "classpath:defaults/volume-claim-template.json";
    
    private static final TypeReference<Map<String, Object>> TEMPLATE_TYPE = new TypeReference<>() {};
    
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    
    public ControllerConfigurationLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper, Clock clock) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }
    
    public ControllerConfiguration load(Sources sources) {
        List<LimitSpec> specs = readJson("limit-specs", sources.limitSpecs(), DEFAULT_LIMIT_SPECS,
            new TypeReference<List<LimitSpec>>() {});
        List<LimitPlan> plans = readJson("limit-plans", sources.limitPlans(), DEFAULT_LIMIT_PLANS,
            new TypeReference<List<LimitPlan>>() {});
        LimitCatalog catalog = LimitCatalog.build(specs, plans, blankToNull(sources.defaultPlan()));
        
        ReservedNamePolicy namePolicy = loadNamePolicy(sources);
        
        ResourceTemplates templates = new ResourceTemplates(
            readJson("secret-template", sources.secretTemplate(), DEFAULT_SECRET_TEMPLATE, TEMPLATE_TYPE),
            readJson("volume-template", sources.volumeTemplate(), DEFAULT_VOLUME_TEMPLATE, TEMPLATE_TYPE),
            readJson("volume-claim-template", sources.volumeClaimTemplate(), DEFAULT_VOLUME_CLAIM_TEMPLATE,
                TEMPLATE_TYPE)
        );
        
        log.info("Limit catalog loaded: {} specs, {} plans, default plan '{}', {} reserved name rules",
            catalog.specCount(), catalog.planCount(), catalog.defaultPlan().id(), namePolicy.size());
        
        return new ControllerConfiguration(catalog, namePolicy, templates, clock.instant());
    }
    
    private ReservedNamePolicy loadNamePolicy(Sources sources) {
        List<String> names = Arrays.stream(Optional.ofNullable(sources.reservedNames()).orElse("").split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        List<String> patterns = readText("reserved-name-patterns", sources.reservedNamePatterns(),
            DEFAULT_RESERVED_PATTERNS).lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty() && !line.startsWith("#"))
            .toList();
        try {
            return ReservedNamePolicy.of(names, patterns);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("reserved-name-patterns", e.getDescription(), e);
        }
    }
    
    private <T> T readJson(String name, String location, String fallback, TypeReference<T> type) {
        Resource resource = locate(name, location, fallback);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new ConfigurationException(name, "cannot read " + resource.getDescription(), e);
        }
    }
    
    private String readText(String name, String location, String fallback) {
        Resource resource = locate(name, location, fallback);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(name, "cannot read " + resource.getDescription(), e);
        }
    }
    
    private Resource locate(String name, String location, String fallback) {
        if (location != null && !location.isBlank()) {
            Resource configured = resourceLoader.getResource(location.trim());
            if (configured.exists()) {
                log.debug("Using configured {} from {}", name, location);
                return configured;
            }
            log.warn("Configured {} at {} does not exist, falling back to built-in default", name, location);
        }
        Resource builtIn = resourceLoader.getResource(fallback);
        if (!builtIn.exists()) {
            throw new ConfigurationException(name, "built-in default " + fallback + " is missing");
        }
        return builtIn;
    }
    
    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
    
    /**
     * Configured locations. Any of them may be null or blank.
     */
    public record Sources(
        String limitSpecs,
        String limitPlans,
        String defaultPlan,
        String reservedNames,
        String reservedNamePatterns,
        String secretTemplate,
        String volumeTemplate,
        String volumeClaimTemplate
    ) {
        
        public static Sources defaults() {
            return new Sources(null, null, null, null, null, null, null, null);
        }
    }
}
