package com.platform.paas.catalog;

import com.platform.paas.error.ConfigurationException;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping of limit specs and plans, built once per process.
 * <p>
 * Plans are resolved into per-kind bounds at construction, so {@link #resolve(String)}
 * is a single hash lookup. Nothing mutates the catalog after construction, which makes
 * concurrent unsynchronized reads safe.
 */
public final class LimitCatalog {
    
    private final Map<String, LimitSpec> specs;
    private final Map<String, ResolvedPlan> plans;
    private final ResolvedPlan defaultPlan;
    
    private LimitCatalog(Map<String, LimitSpec> specs, Map<String, ResolvedPlan> plans, ResolvedPlan defaultPlan) {
        this.specs = specs;
        this.plans = plans;
        this.defaultPlan = defaultPlan;
    }
    
    /**
     * Validate and index the given specs and plans.
     *
     * @param defaultPlanId explicit default, or null to use the plan flagged default
     *                      (then the first plan)
     * @throws ConfigurationException on dangling references, duplicate kinds within a plan,
     *                                unparseable quantities or a floor above its ceiling
     */
    public static LimitCatalog build(Collection<LimitSpec> specs, Collection<LimitPlan> plans, String defaultPlanId) {
        Map<String, LimitSpec> specIndex = new LinkedHashMap<>();
        for (LimitSpec spec : specs) {
            validateSpec(spec);
            if (specIndex.putIfAbsent(spec.id(), spec) != null) {
                throw new ConfigurationException("limit-specs", "duplicate spec id " + spec.id());
            }
        }
        
        Map<String, ResolvedPlan> planIndex = new LinkedHashMap<>();
        for (LimitPlan plan : plans) {
            if (plan.id() == null || plan.id().isBlank()) {
                throw new ConfigurationException("limit-plans", "plan without id");
            }
            if (planIndex.putIfAbsent(plan.id(), resolvePlan(plan, specIndex)) != null) {
                throw new ConfigurationException("limit-plans", "duplicate plan id " + plan.id());
            }
        }
        
        if (planIndex.isEmpty()) {
            throw new ConfigurationException("limit-plans", "catalog contains no plans");
        }
        
        return new LimitCatalog(
            Map.copyOf(specIndex),
            Map.copyOf(planIndex),
            pickDefault(planIndex, defaultPlanId)
        );
    }
    
    private static void validateSpec(LimitSpec spec) {
        if (spec.id() == null || spec.id().isBlank()) {
            throw new ConfigurationException("limit-specs", "spec without id");
        }
        if (spec.kind() == null) {
            throw new ConfigurationException("limit-specs", "spec " + spec.id() + " has no kind");
        }
        try {
            ResourceBounds bounds = ResourceBounds.of(spec, null);
            if (bounds.floorAmount() != null && bounds.ceilingAmount() != null
                    && bounds.floorAmount().compareTo(bounds.ceilingAmount()) > 0) {
                throw new ConfigurationException("limit-specs",
                    String.format("spec %s floor %s exceeds ceiling %s", spec.id(), spec.floor(), spec.ceiling()));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("limit-specs", "spec " + spec.id() + ": " + e.getMessage(), e);
        }
    }
    
    private static ResolvedPlan resolvePlan(LimitPlan plan, Map<String, LimitSpec> specIndex) {
        Map<ResourceKind, ResourceBounds> bounds = new EnumMap<>(ResourceKind.class);
        for (String specId : plan.specs()) {
            LimitSpec spec = specIndex.get(specId);
            if (spec == null) {
                throw new ConfigurationException("limit-plans",
                    String.format("plan %s references unknown spec %s", plan.id(), specId));
            }
            if (bounds.containsKey(spec.kind())) {
                throw new ConfigurationException("limit-plans",
                    String.format("plan %s has more than one %s spec", plan.id(), spec.kind()));
            }
            
            ResourceBounds resolved;
            try {
                resolved = ResourceBounds.of(spec, plan.ceilings().get(spec.kind()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("limit-plans", "plan " + plan.id() + ": " + e.getMessage(), e);
            }
            if (resolved.floorAmount() != null && resolved.ceilingAmount() != null
                    && resolved.floorAmount().compareTo(resolved.ceilingAmount()) > 0) {
                throw new ConfigurationException("limit-plans",
                    String.format("plan %s ceiling override %s is below the %s floor", plan.id(),
                        resolved.ceiling(), spec.kind()));
            }
            bounds.put(spec.kind(), resolved);
        }
        return new ResolvedPlan(plan, bounds);
    }
    
    private static ResolvedPlan pickDefault(Map<String, ResolvedPlan> plans, String defaultPlanId) {
        if (defaultPlanId != null && !defaultPlanId.isBlank()) {
            ResolvedPlan explicit = plans.get(defaultPlanId);
            if (explicit == null) {
                throw new ConfigurationException("default-plan", "unknown default plan " + defaultPlanId);
            }
            return explicit;
        }
        return plans.values().stream()
            .filter(p -> p.plan().defaultPlan())
            .findFirst()
            .orElseGet(() -> plans.values().iterator().next());
    }
    
    /**
     * Look up a plan by id.
     */
    public Optional<ResolvedPlan> resolve(String planId) {
        if (planId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(plans.get(planId));
    }
    
    /**
     * Resolve a requested plan, using the default plan when none was requested.
     * An explicitly requested but unknown plan resolves to empty.
     */
    public Optional<ResolvedPlan> resolveOrDefault(String planId) {
        if (planId == null || planId.isBlank()) {
            return Optional.of(defaultPlan);
        }
        return resolve(planId);
    }
    
    public ResolvedPlan defaultPlan() {
        return defaultPlan;
    }
    
    public Optional<LimitSpec> spec(String specId) {
        return Optional.ofNullable(specs.get(specId));
    }
    
    public List<String> planIds() {
        return plans.keySet().stream().sorted().toList();
    }
    
    public int specCount() {
        return specs.size();
    }
    
    public int planCount() {
        return plans.size();
    }
}
