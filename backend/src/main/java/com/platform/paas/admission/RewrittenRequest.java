package com.platform.paas.admission;

import java.time.Instant;
import java.util.List;

/**
 * An admitted request, conforming to its resolved plan.
 *
 * @param taskId id of the sync-state task enqueued for this admission, null until dispatched
 */
public record RewrittenRequest(
    String tenantId,
    String planId,
    WorkloadDescriptor workload,
    List<Mutation> mutations,
    String taskId,
    Instant admittedAt
) {
    
    public RewrittenRequest {
        mutations = mutations == null ? List.of() : List.copyOf(mutations);
    }
    
    public boolean isModified() {
        return !mutations.isEmpty();
    }
    
    public RewrittenRequest withTaskId(String id) {
        return new RewrittenRequest(tenantId, planId, workload, mutations, id, admittedAt);
    }
}
