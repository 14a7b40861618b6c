package com.platform.datakeeper.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Standardized error response model.
 * All API errors return this structure for consistency.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Unique error code (e.g., DK-301).
     */
    private String code;
    
    /**
     * Human-readable error message.
     */
    private String message;
    
    /**
     * Detailed description for debugging.
     */
    private String detail;
    
    /**
     * Whether this error is fatal (requires intervention) or recoverable (can retry).
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    /**
     * Request path that caused the error.
     */
    private String path;
    
    /**
     * Trace ID for correlating with logs.
     */
    private String traceId;
    
    private List<FieldError> fieldErrors;
    
    /**
     * Field-level validation error.
     */
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
}
