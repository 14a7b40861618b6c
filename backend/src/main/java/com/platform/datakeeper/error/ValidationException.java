package com.platform.datakeeper.error;

/**
 * Malformed policy document, trigger, action or request.
 * A policy load that raises this is rejected as a whole.
 */
public class ValidationException extends DataKeeperException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value for field '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = null;
    }
    
    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_FIELD_VALUE, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
