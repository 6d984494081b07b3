package com.platform.paas.admission;

import com.platform.paas.error.ErrorCode;

/**
 * Why the gate refused a request.
 */
public enum RejectionReason {
    UNKNOWN_PLAN(ErrorCode.UNKNOWN_PLAN),
    QUOTA_EXCEEDED(ErrorCode.QUOTA_EXCEEDED),
    NAME_RESERVED(ErrorCode.NAME_RESERVED),
    QUEUE_UNAVAILABLE(ErrorCode.QUEUE_UNAVAILABLE);
    
    private final ErrorCode errorCode;
    
    RejectionReason(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }
    
    public ErrorCode errorCode() {
        return errorCode;
    }
}
