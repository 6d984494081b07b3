package com.platform.paas.admission;

import com.platform.paas.reconciliation.DesiredStateRepository;
import com.platform.paas.reconciliation.DesiredWorkload;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Records admitted workloads as desired state before their sync task is dispatched,
 * so the sync always reads the state it was enqueued for.
 * 
 * If the queue refuses the task the previous desired state is put back, so a refused
 * submission leaves nothing behind for a later sync to apply.
 */
@Slf4j
@Service
public class WorkloadSubmissionService {
    
    private final AdmissionGate gate;
    private final DesiredStateRepository desiredState;
    
    public WorkloadSubmissionService(AdmissionGate gate, DesiredStateRepository desiredState) {
        this.gate = gate;
        this.desiredState = desiredState;
    }
    
    /**
     * @throws AdmissionRejectedException if the gate rejects the request or the queue refuses its task
     */
    public RewrittenRequest submit(MutationRequest request) {
        MDC.put("tenantId", request.tenantId());
        try {
            RewrittenRequest rewritten = gate.evaluate(request).orElseThrow();
            WorkloadDescriptor workload = rewritten.workload();
            Optional<DesiredWorkload> previous = desiredState.find(
                rewritten.tenantId(), workload.appId(), workload.name());
            desiredState.save(rewritten);
            
            AdmissionResult dispatched = gate.dispatch(rewritten);
            if (!dispatched.isAdmitted()) {
                restore(rewritten.tenantId(), workload, previous);
            }
            return dispatched.orElseThrow();
        } finally {
            MDC.remove("tenantId");
        }
    }
    
    private void restore(String tenantId, WorkloadDescriptor workload, Optional<DesiredWorkload> previous) {
        if (previous.isPresent()) {
            DesiredWorkload prior = previous.get();
            desiredState.save(new RewrittenRequest(prior.tenantId(), prior.planId(), prior.workload(),
                List.of(), null, prior.updatedAt()));
            log.warn("Sync for {}/{} refused by the queue, previous desired state restored",
                workload.appId(), workload.name());
        } else {
            desiredState.delete(tenantId, workload.appId(), workload.name());
            log.warn("Sync for {}/{} refused by the queue, desired state discarded",
                workload.appId(), workload.name());
        }
    }
    
    /**
     * Remove a workload from desired state. Cluster objects are left for the operator.
     */
    public boolean remove(String tenantId, String appId, String name) {
        return desiredState.delete(tenantId, appId, name);
    }
}
