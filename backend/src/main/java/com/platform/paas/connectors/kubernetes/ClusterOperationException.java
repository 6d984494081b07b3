package com.platform.paas.connectors.kubernetes;

import com.platform.paas.error.ControlPlaneException;
import com.platform.paas.error.ErrorCode;

/**
 * A failed cluster API call. {@code retryable} is false when the API rejected the
 * object itself and resending it cannot succeed.
 */
public class ClusterOperationException extends ControlPlaneException {
    
    private final String operation;
    private final int statusCode;
    private final boolean retryable;
    
    public ClusterOperationException(String operation, int statusCode, boolean retryable, String message, Throwable cause) {
        super(ErrorCode.CLUSTER_UNAVAILABLE, String.format("%s failed: %s", operation, message), cause);
        this.operation = operation;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }
    
    public String getOperation() {
        return operation;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
}
