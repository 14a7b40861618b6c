package com.platform.datakeeper.error;

/**
 * Base exception for all DataKeeper exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class DataKeeperException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected DataKeeperException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected DataKeeperException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected DataKeeperException(ErrorCode errorCode, String message, Throwable cause) {
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
