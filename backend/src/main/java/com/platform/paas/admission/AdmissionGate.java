package com.platform.paas.admission;

import com.platform.paas.catalog.ResolvedPlan;
import com.platform.paas.catalog.ResourceBounds;
import com.platform.paas.catalog.ResourceKind;
import com.platform.paas.catalog.ResourceQuantities;
import com.platform.paas.config.ControllerConfiguration;
import com.platform.paas.error.ValidationException;
import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.queue.Band;
import com.platform.paas.queue.QueueUnavailableException;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.queue.TaskScope;
import com.platform.paas.reconciliation.DesiredWorkload;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Synchronous admission decision for workload mutations.
 * 
 * Checks, in order:
 * 1. The requested plan resolves (absent plan id means the default plan)
 * 2. Every constrained resource value is within the plan's bounds
 * 3. App, workload and volume names are valid and not reserved
 * 
 * Values below a floor are raised to the floor. Values above a ceiling reject the request.
 * A successful admission enqueues exactly one high-band sync-state task; a rejection enqueues nothing.
 */
@Slf4j
@Component
public class AdmissionGate {
    
    private final ControllerConfiguration configuration;
    private final ReconciliationQueue queue;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    
    public AdmissionGate(
            ControllerConfiguration configuration,
            ReconciliationQueue queue,
            MetricsRegistry metricsRegistry,
            Clock clock) {
        this.configuration = configuration;
        this.queue = queue;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
    }
    
    /**
     * Decide on a request and, if it is admitted, enqueue its sync-state task.
     *
     * @throws ValidationException if a resource value is not a quantity
     */
    public AdmissionResult admit(MutationRequest request) {
        MDC.put("tenantId", request.tenantId());
        try {
            AdmissionResult result = evaluate(request);
            if (!result.isAdmitted()) {
                return result;
            }
            return dispatch(result.admitted());
        } finally {
            MDC.remove("tenantId");
        }
    }
    
    /**
     * Decide on a request without enqueueing anything. Rejections are logged and counted here;
     * admissions are counted once dispatched.
     */
    public AdmissionResult evaluate(MutationRequest request) {
        AdmissionResult result = decide(request);
        if (!result.isAdmitted()) {
            record(result);
        }
        return result;
    }
    
    private AdmissionResult decide(MutationRequest request) {
        WorkloadDescriptor workload = request.workload();
        
        Optional<ResolvedPlan> resolved = configuration.catalog().resolveOrDefault(request.planId());
        if (resolved.isEmpty()) {
            return AdmissionResult.rejected(Rejection.unknownPlan(request.planId()));
        }
        ResolvedPlan plan = resolved.get();
        
        List<Mutation> mutations = new ArrayList<>();
        List<ContainerResources> containers = new ArrayList<>();
        for (ContainerResources container : workload.containers()) {
            String base = "/containers/" + container.name();
            Map<ResourceKind, String> requests = new EnumMap<>(ResourceKind.class);
            Map<ResourceKind, String> limits = new EnumMap<>(ResourceKind.class);
            Optional<Rejection> rejection = conform(plan, container.requests(), base + "/requests/", requests, mutations)
                .or(() -> conform(plan, container.limits(), base + "/limits/", limits, mutations));
            if (rejection.isPresent()) {
                return AdmissionResult.rejected(rejection.get());
            }
            containers.add(new ContainerResources(container.name(), container.image(), requests, limits));
        }
        
        List<VolumeRequest> volumes = new ArrayList<>();
        for (VolumeRequest volume : workload.volumes()) {
            String path = "/volumes/" + volume.name() + "/size";
            Optional<ResourceBounds> bounds = plan.boundsFor(ResourceKind.STORAGE);
            if (bounds.isEmpty()) {
                volumes.add(volume);
                continue;
            }
            Conformed conformed = conformValue(bounds.get(), path, volume.size());
            if (conformed.rejection() != null) {
                return AdmissionResult.rejected(conformed.rejection());
            }
            if (conformed.mutation() != null) {
                mutations.add(conformed.mutation());
            }
            volumes.add(new VolumeRequest(volume.name(), conformed.value()));
        }
        
        Optional<Rejection> nameRejection = checkNames(workload);
        if (nameRejection.isPresent()) {
            return AdmissionResult.rejected(nameRejection.get());
        }
        
        RewrittenRequest rewritten = new RewrittenRequest(
            request.tenantId(),
            plan.id(),
            workload.withResources(containers, volumes),
            mutations,
            null,
            clock.instant()
        );
        return AdmissionResult.admitted(rewritten);
    }
    
    /**
     * Enqueue the sync-state task for an already evaluated request.
     * Fails closed: if the queue refuses the task the request is rejected.
     */
    public AdmissionResult dispatch(RewrittenRequest rewritten) {
        ReconciliationTask task = ReconciliationTask.of(
            TaskKind.SYNC_STATE,
            Band.HIGH,
            TaskScope.app(rewritten.tenantId(), rewritten.workload().appId()),
            null
        );
        AdmissionResult result;
        try {
            ReconciliationTask accepted = queue.enqueue(task);
            result = AdmissionResult.admitted(rewritten.withTaskId(accepted.id()));
            log.info("Admitted {}/{} on plan {} with {} mutation(s), sync task {}",
                rewritten.workload().appId(), rewritten.workload().name(), rewritten.planId(),
                rewritten.mutations().size(), accepted.id());
        } catch (QueueUnavailableException e) {
            result = AdmissionResult.rejected(Rejection.queueUnavailable(e.getMessage()));
        }
        record(result);
        return result;
    }
    
    private Optional<Rejection> checkNames(WorkloadDescriptor workload) {
        ReservedNamePolicy policy = configuration.namePolicy();
        Optional<String> violation = policy.check(workload.appId());
        if (violation.isEmpty() && workload.appId().length() > DesiredWorkload.MAX_APP_ID_LENGTH) {
            violation = Optional.of(String.format("'%s' is longer than %d characters",
                workload.appId(), DesiredWorkload.MAX_APP_ID_LENGTH));
        }
        if (violation.isPresent()) {
            return Optional.of(Rejection.nameReserved("/appId", workload.appId(), violation.get()));
        }
        violation = policy.check(workload.name());
        if (violation.isPresent()) {
            return Optional.of(Rejection.nameReserved("/name", workload.name(), violation.get()));
        }
        for (int i = 0; i < workload.volumes().size(); i++) {
            String name = workload.volumes().get(i).name();
            violation = policy.check(name);
            if (violation.isPresent()) {
                return Optional.of(Rejection.nameReserved("/volumes/" + i + "/name", name, violation.get()));
            }
        }
        return Optional.empty();
    }
    
    private Optional<Rejection> conform(
            ResolvedPlan plan,
            Map<ResourceKind, String> values,
            String pathPrefix,
            Map<ResourceKind, String> target,
            List<Mutation> mutations) {
        for (Map.Entry<ResourceKind, String> entry : values.entrySet()) {
            Optional<ResourceBounds> bounds = plan.boundsFor(entry.getKey());
            if (bounds.isEmpty()) {
                target.put(entry.getKey(), entry.getValue());
                continue;
            }
            Conformed conformed = conformValue(bounds.get(), pathPrefix + entry.getKey().key(), entry.getValue());
            if (conformed.rejection() != null) {
                return Optional.of(conformed.rejection());
            }
            if (conformed.mutation() != null) {
                mutations.add(conformed.mutation());
            }
            target.put(entry.getKey(), conformed.value());
        }
        return Optional.empty();
    }
    
    private Conformed conformValue(ResourceBounds bounds, String path, String value) {
        BigDecimal amount;
        try {
            amount = ResourceQuantities.amount(value);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidQuantity(path, value);
        }
        if (bounds.isAboveCeiling(amount)) {
            return new Conformed(value, null, Rejection.quotaExceeded(path, bounds.ceiling(), value));
        }
        if (bounds.isBelowFloor(amount)) {
            log.debug("Raising {} from {} to floor {} ({})", path, value, bounds.floor(), bounds.specId());
            return new Conformed(bounds.floor(), new Mutation(path, value, bounds.floor()), null);
        }
        return new Conformed(value, null, null);
    }
    
    private void record(AdmissionResult result) {
        if (result.isAdmitted()) {
            metricsRegistry.recordAdmission(true, "none", result.admitted().mutations().size());
        } else {
            Rejection rejection = result.rejection();
            log.warn("Rejected mutation ({}): {}", rejection.reason(), rejection.message());
            metricsRegistry.recordAdmission(false, rejection.reason().name().toLowerCase(), 0);
        }
    }
    
    private record Conformed(String value, Mutation mutation, Rejection rejection) {
    }
}
