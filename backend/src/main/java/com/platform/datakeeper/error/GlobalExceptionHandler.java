package com.platform.datakeeper.error;

import com.platform.datakeeper.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Renders every REST failure as an {@link ErrorResponse}, logs it with matching
 * severity and counts it by error code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final MetricsRegistry metricsRegistry;

    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    // ==================== DataKeeper Exceptions ====================

    @ExceptionHandler(DataKeeperException.class)
    public ResponseEntity<ErrorResponse> handleDataKeeperException(
            DataKeeperException ex, HttpServletRequest request) {

        String traceId = traceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);

        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }

        return respond(status, body(errorCode, status, ex.getMessage(), request, traceId));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] {} not found: {}", traceId, ex.getResourceType(), ex.getResourceId());

        return respond(HttpStatus.NOT_FOUND, body(ex.getErrorCode(), HttpStatus.NOT_FOUND, ex.getMessage(), request, traceId));
    }

    /**
     * Policy documents and request values; the offending field is reported when known.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] Rejected: {} (field: {})", traceId, ex.getMessage(), ex.getField());

        ErrorResponse.ErrorResponseBuilder builder =
            body(ex.getErrorCode(), HttpStatus.BAD_REQUEST, ex.getMessage(), request, traceId);
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(fieldError(ex.getField(), ex.getMessage(), ex.getRejectedValue())));
        }
        return respond(HttpStatus.BAD_REQUEST, builder);
    }

    /**
     * The job ledger is unusable; the request fails and the error is marked fatal.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(
            DataAccessException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.error("[{}] FATAL: Ledger storage error: {}", traceId, ex.getMessage(), ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
            body(ErrorCode.LEDGER_STORAGE_ERROR, HttpStatus.INTERNAL_SERVER_ERROR,
                "Ledger storage operation failed", request, traceId)
                .detail(ex.getMostSpecificCause().getMessage()));
    }

    // ==================== Request Errors ====================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        String traceId = traceId();
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> fieldError(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
            .toList();
        log.warn("[{}] Request body failed validation: {}", traceId, fieldErrors);

        return respond(HttpStatus.BAD_REQUEST,
            body(ErrorCode.VALIDATION_ERROR, HttpStatus.BAD_REQUEST, "Request validation failed", request, traceId)
                .fieldErrors(fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST,
            body(ErrorCode.INVALID_REQUEST, HttpStatus.BAD_REQUEST, "Invalid request body", request, traceId)
                .detail(ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] Missing parameter: {}", traceId, ex.getParameterName());

        return respond(HttpStatus.BAD_REQUEST, body(ErrorCode.MISSING_REQUIRED_FIELD, HttpStatus.BAD_REQUEST,
            "Missing required parameter: " + ex.getParameterName(), request, traceId));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

        String traceId = traceId();
        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());

        return respond(HttpStatus.BAD_REQUEST, body(ErrorCode.INVALID_FIELD_VALUE, HttpStatus.BAD_REQUEST,
            String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()), request, traceId));
    }

    // ==================== Catch-All ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {

        String traceId = traceId();
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
            body(ErrorCode.INTERNAL_ERROR, HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred", request, traceId)
                .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage()));
    }

    // ==================== Helpers ====================

    private ErrorResponse.ErrorResponseBuilder body(
            ErrorCode errorCode, HttpStatus status, String message, HttpServletRequest request, String traceId) {
        metricsRegistry.incrementCounter("datakeeper.api.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));

        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse.ErrorResponseBuilder body) {
        return ResponseEntity.status(status).body(body.build());
    }

    private static ErrorResponse.FieldError fieldError(String field, String message, Object rejectedValue) {
        return ErrorResponse.FieldError.builder()
            .field(field)
            .message(message)
            .rejectedValue(rejectedValue)
            .build();
    }

    /**
     * The request's trace id from the MDC, or a fresh short id for this response.
     */
    private static String traceId() {
        String traceId = MDC.get("traceId");
        return traceId != null ? traceId : UUID.randomUUID().toString().substring(0, 8);
    }

    private static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, POLICY_NOT_FOUND, JOB_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION ->
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE,
                 INVALID_CONDITION, INVALID_CRON, INTAKE_MALFORMED ->
                HttpStatus.BAD_REQUEST;
            case INTAKE_UNAVAILABLE, INTAKE_TIMEOUT ->
                HttpStatus.SERVICE_UNAVAILABLE;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
