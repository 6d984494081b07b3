package com.platform.paas.queue;

import com.platform.paas.error.ControlPlaneException;
import com.platform.paas.error.ErrorCode;

/**
 * Thrown when the queue cannot accept work: it is closed or a band is at capacity.
 */
public class QueueUnavailableException extends ControlPlaneException {
    
    public QueueUnavailableException(String message) {
        super(ErrorCode.QUEUE_UNAVAILABLE, message);
    }
}
