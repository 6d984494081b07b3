package com.platform.paas.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A named bundle of limit specs, optionally overriding the ceiling per kind.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LimitPlan(
    String id,
    List<String> specs,
    Map<ResourceKind, String> ceilings,
    @JsonProperty("default") boolean defaultPlan,
    String description
) {
    
    /**
     * @throws IllegalArgumentException if a spec reference or ceiling is null
     */
    public LimitPlan {
        if (specs != null && specs.contains(null)) {
            throw new IllegalArgumentException("plan " + id + " lists a null spec");
        }
        if (ceilings != null && ceilings.containsValue(null)) {
            throw new IllegalArgumentException("plan " + id + " has a null ceiling");
        }
        specs = specs == null ? List.of() : List.copyOf(specs);
        ceilings = ceilings == null ? Map.of() : Map.copyOf(ceilings);
    }
}
