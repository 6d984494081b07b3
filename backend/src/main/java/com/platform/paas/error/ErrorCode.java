package com.platform.paas.error;

/**
 * Standardized error codes for the controller.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: CP-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Lookup errors (workload, plan, task)
 * - 4xx: System errors (database, broker, cluster)
 * - 6xx: Admission and reconciliation errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("CP-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("CP-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("CP-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    CONSTRAINT_VIOLATION("CP-104", "Constraint violation", ErrorCategory.RECOVERABLE),
    
    // ==================== Lookup Errors (3xx) ====================
    
    WORKLOAD_NOT_FOUND("CP-300", "Workload not found", ErrorCategory.RECOVERABLE),
    UNKNOWN_PLAN("CP-301", "Limit plan not found", ErrorCategory.RECOVERABLE),
    TASK_NOT_FOUND("CP-302", "Reconciliation task not found", ErrorCategory.RECOVERABLE),
    
    // ==================== System Errors (4xx) ====================
    
    DATABASE_ERROR("CP-400", "Database error", ErrorCategory.FATAL),
    KAFKA_UNAVAILABLE("CP-410", "Kafka unavailable", ErrorCategory.RECOVERABLE),
    QUEUE_UNAVAILABLE("CP-411", "Reconciliation queue unavailable", ErrorCategory.RECOVERABLE),
    CLUSTER_UNAVAILABLE("CP-420", "Cluster API unavailable", ErrorCategory.RECOVERABLE),
    
    // ==================== Admission / Reconciliation Errors (6xx) ====================
    
    QUOTA_EXCEEDED("CP-601", "Requested resources exceed the plan ceiling", ErrorCategory.RECOVERABLE),
    NAME_RESERVED("CP-602", "Name is reserved or malformed", ErrorCategory.RECOVERABLE),
    HANDLER_TRANSIENT("CP-610", "Task handler failed transiently", ErrorCategory.RECOVERABLE),
    HANDLER_FATAL("CP-611", "Task handler failed permanently", ErrorCategory.FATAL),
    TASK_SUPERSEDED("CP-612", "Task generation superseded", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    UNEXPECTED_ERROR("CP-901", "Unexpected error occurred", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("CP-902", "Configuration error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - system is in bad state, may require intervention.
         */
        FATAL
    }
}
