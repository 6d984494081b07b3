package com.platform.paas.catalog;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A limit plan with its spec references resolved into per-kind bounds.
 */
public record ResolvedPlan(LimitPlan plan, Map<ResourceKind, ResourceBounds> bounds) {
    
    public ResolvedPlan {
        Map<ResourceKind, ResourceBounds> copy = new EnumMap<>(ResourceKind.class);
        copy.putAll(bounds);
        bounds = Collections.unmodifiableMap(copy);
    }
    
    public String id() {
        return plan.id();
    }
    
    public Optional<ResourceBounds> boundsFor(ResourceKind kind) {
        return Optional.ofNullable(bounds.get(kind));
    }
}
