package com.platform.paas.worker;

import com.platform.paas.error.ControlPlaneException;
import com.platform.paas.error.ErrorCode;

/**
 * A handler failure worth retrying: cluster or broker unavailable, timeouts, conflicts.
 */
public class HandlerTransientException extends ControlPlaneException {
    
    public HandlerTransientException(String message) {
        super(ErrorCode.HANDLER_TRANSIENT, message);
    }
    
    public HandlerTransientException(String message, Throwable cause) {
        super(ErrorCode.HANDLER_TRANSIENT, message, cause);
    }
}
