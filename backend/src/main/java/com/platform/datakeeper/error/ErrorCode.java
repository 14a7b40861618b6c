package com.platform.datakeeper.error;

/**
 * Standardized error codes for DataKeeper.
 * 
 * Format: DK-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors (policy documents, requests)
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: System errors (ledger storage, external feeds)
 * - 5xx: Job and action errors
 * - 9xx: Internal errors
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("DK-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("DK-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("DK-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("DK-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    INVALID_CONDITION("DK-104", "Invalid condition expression", ErrorCategory.RECOVERABLE),
    INVALID_CRON("DK-105", "Invalid cron expression", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("DK-300", "Resource not found", ErrorCategory.RECOVERABLE),
    POLICY_NOT_FOUND("DK-301", "Policy not found", ErrorCategory.RECOVERABLE),
    JOB_NOT_FOUND("DK-302", "Job not found", ErrorCategory.RECOVERABLE),
    
    // ==================== System Errors (4xx) ====================
    
    LEDGER_STORAGE_ERROR("DK-400", "Job ledger storage error", ErrorCategory.FATAL),
    INTAKE_UNAVAILABLE("DK-410", "External metric or event source unavailable", ErrorCategory.RECOVERABLE),
    INTAKE_MALFORMED("DK-411", "External metric or event malformed", ErrorCategory.RECOVERABLE),
    INTAKE_TIMEOUT("DK-412", "External metric read timed out", ErrorCategory.RECOVERABLE),
    
    // ==================== Job/Action Errors (5xx) ====================
    
    INVALID_TRANSITION("DK-500", "Invalid job status transition", ErrorCategory.RECOVERABLE),
    ACTION_IO_ERROR("DK-510", "Action I/O failure", ErrorCategory.RECOVERABLE),
    ACTION_FORMAT_ERROR("DK-511", "Malformed data for action", ErrorCategory.RECOVERABLE),
    ACTION_CONSTRAINT_ERROR("DK-512", "Action constraint violated", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("DK-900", "Internal server error", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("DK-902", "Configuration error", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("DK-903", "Serialization error", ErrorCategory.RECOVERABLE);
    
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
         * Recoverable at the narrowest scope (request, trigger, job).
         */
        RECOVERABLE,
        
        /**
         * Process cannot continue safely.
         */
        FATAL
    }
}
