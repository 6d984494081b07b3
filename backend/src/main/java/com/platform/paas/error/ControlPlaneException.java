package com.platform.paas.error;

/**
 * Base exception for all controller exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class ControlPlaneException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ControlPlaneException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected ControlPlaneException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ControlPlaneException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
