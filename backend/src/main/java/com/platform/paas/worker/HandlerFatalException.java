package com.platform.paas.worker;

import com.platform.paas.error.ControlPlaneException;
import com.platform.paas.error.ErrorCode;

/**
 * A handler failure that no retry can fix. The task goes straight to the dead-task list.
 */
public class HandlerFatalException extends ControlPlaneException {
    
    public HandlerFatalException(String message) {
        super(ErrorCode.HANDLER_FATAL, message);
    }
    
    public HandlerFatalException(String message, Throwable cause) {
        super(ErrorCode.HANDLER_FATAL, message, cause);
    }
}
