package com.platform.paas.error;

/**
 * Exception for request values the controller cannot interpret.
 */
public class ValidationException extends ControlPlaneException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    /**
     * A value that is not a Kubernetes resource quantity.
     */
    public static ValidationException invalidQuantity(String field, String value) {
        return new ValidationException(field, value, "not a resource quantity");
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
