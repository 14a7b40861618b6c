package com.platform.datakeeper.error;

/**
 * External metric or event source unreachable, slow, or malformed.
 * Skips the affected trigger for the current tick only.
 */
public class IntakeException extends DataKeeperException {
    
    private final String source;
    
    public IntakeException(ErrorCode errorCode, String source, String message) {
        super(errorCode, message);
        this.source = source;
    }
    
    public IntakeException(ErrorCode errorCode, String source, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.source = source;
    }
    
    public static IntakeException unavailable(String source, Throwable cause) {
        return new IntakeException(ErrorCode.INTAKE_UNAVAILABLE, source,
            String.format("Source '%s' unavailable: %s", source, cause.getMessage()), cause);
    }
    
    public static IntakeException timeout(String source) {
        return new IntakeException(ErrorCode.INTAKE_TIMEOUT, source,
            String.format("Source '%s' did not answer in time", source));
    }
    
    public static IntakeException malformed(String source, String detail) {
        return new IntakeException(ErrorCode.INTAKE_MALFORMED, source,
            String.format("Source '%s' sent malformed data: %s", source, detail));
    }
    
    public String getSource() {
        return source;
    }
}
