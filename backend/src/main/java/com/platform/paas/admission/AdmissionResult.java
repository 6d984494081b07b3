package com.platform.paas.admission;

/**
 * Outcome of an admission decision: exactly one of {@code admitted} or {@code rejection} is set.
 */
public record AdmissionResult(RewrittenRequest admitted, Rejection rejection) {
    
    public static AdmissionResult admitted(RewrittenRequest request) {
        return new AdmissionResult(request, null);
    }
    
    public static AdmissionResult rejected(Rejection rejection) {
        return new AdmissionResult(null, rejection);
    }
    
    public boolean isAdmitted() {
        return admitted != null;
    }
    
    /**
     * @throws AdmissionRejectedException if the request was rejected
     */
    public RewrittenRequest orElseThrow() {
        if (rejection != null) {
            throw new AdmissionRejectedException(rejection);
        }
        return admitted;
    }
}
