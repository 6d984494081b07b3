package com.platform.paas.admission;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A refused request with enough detail for the caller to correct it.
 *
 * @param dimension pointer-style path of the offending value or name, if any
 * @param limit     the bound that was violated, if any
 * @param requested the value the caller asked for, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Rejection(
    RejectionReason reason,
    String message,
    String dimension,
    String limit,
    String requested
) {
    
    public static Rejection unknownPlan(String planId) {
        return new Rejection(RejectionReason.UNKNOWN_PLAN,
            "Limit plan '" + planId + "' does not exist", "planId", null, planId);
    }
    
    public static Rejection quotaExceeded(String dimension, String ceiling, String requested) {
        return new Rejection(RejectionReason.QUOTA_EXCEEDED,
            String.format("%s requests %s, above the plan ceiling of %s", dimension, requested, ceiling),
            dimension, ceiling, requested);
    }
    
    public static Rejection nameReserved(String dimension, String name, String detail) {
        return new Rejection(RejectionReason.NAME_RESERVED, detail, dimension, null, name);
    }
    
    public static Rejection queueUnavailable(String detail) {
        return new Rejection(RejectionReason.QUEUE_UNAVAILABLE,
            "Reconciliation queue cannot accept work: " + detail, null, null, null);
    }
    
    /**
     * Non-null details for error responses.
     */
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.name());
        if (dimension != null) {
            details.put("dimension", dimension);
        }
        if (limit != null) {
            details.put("limit", limit);
        }
        if (requested != null) {
            details.put("requested", requested);
        }
        return details;
    }
}
