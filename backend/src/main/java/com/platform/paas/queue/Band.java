package com.platform.paas.queue;

/**
 * Priority bands of the reconciliation queue, highest first.
 * Declaration order is dispatch order.
 */
public enum Band {
    HIGH("priority.high"),
    MIDDLE("priority.middle"),
    LOW("priority.low");
    
    private final String queueName;
    
    Band(String queueName) {
        this.queueName = queueName;
    }
    
    public String queueName() {
        return queueName;
    }
    
    public String tag() {
        return name().toLowerCase();
    }
}
