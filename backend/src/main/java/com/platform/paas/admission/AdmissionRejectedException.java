package com.platform.paas.admission;

import com.platform.paas.error.ControlPlaneException;

/**
 * Carries a {@link Rejection} to the HTTP layer.
 */
public class AdmissionRejectedException extends ControlPlaneException {
    
    private final Rejection rejection;
    
    public AdmissionRejectedException(Rejection rejection) {
        super(rejection.reason().errorCode(), rejection.message());
        this.rejection = rejection;
    }
    
    public Rejection getRejection() {
        return rejection;
    }
}
