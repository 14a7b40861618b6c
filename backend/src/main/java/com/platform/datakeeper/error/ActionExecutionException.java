package com.platform.datakeeper.error;

/**
 * Failure raised by an action plugin while working on a single data unit.
 * Always recoverable at job granularity: the job becomes failed, nothing else stops.
 */
public class ActionExecutionException extends DataKeeperException {
    
    private final Kind kind;
    
    public ActionExecutionException(Kind kind, String message) {
        super(kind.errorCode(), message);
        this.kind = kind;
    }
    
    public ActionExecutionException(Kind kind, String message, Throwable cause) {
        super(kind.errorCode(), message, cause);
        this.kind = kind;
    }
    
    public static ActionExecutionException io(String message, Throwable cause) {
        return new ActionExecutionException(Kind.IO, message, cause);
    }
    
    public static ActionExecutionException format(String message) {
        return new ActionExecutionException(Kind.FORMAT, message);
    }
    
    public static ActionExecutionException constraint(String message) {
        return new ActionExecutionException(Kind.CONSTRAINT, message);
    }
    
    public Kind getKind() {
        return kind;
    }
    
    /**
     * Text persisted as the job's last error.
     */
    public String toLedgerMessage() {
        return kind.name().toLowerCase() + ": " + getMessage();
    }
    
    public enum Kind {
        IO(ErrorCode.ACTION_IO_ERROR),
        FORMAT(ErrorCode.ACTION_FORMAT_ERROR),
        CONSTRAINT(ErrorCode.ACTION_CONSTRAINT_ERROR);
        
        private final ErrorCode errorCode;
        
        Kind(ErrorCode errorCode) {
            this.errorCode = errorCode;
        }
        
        public ErrorCode errorCode() {
            return errorCode;
        }
    }
}
