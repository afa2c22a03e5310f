package com.platform.inventory.error;

import com.platform.inventory.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.UUID;

/**
 * Turns exceptions thrown by the REST API into {@link ErrorResponse} bodies.
 * 
 * Fatal errors are logged at ERROR with the stack trace, recoverable ones at WARN.
 * Every handled error is counted under "inventory.errors" by code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Inventory Exceptions ====================
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.NOT_FOUND, request, Map.of(
            "resourceType", ex.getResourceType(),
            "resourceId", ex.getResourceId()));
    }
    
    @ExceptionHandler(ReconciliationConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(
            ReconciliationConflictException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.CONFLICT, request, Map.of(
            "providerId", ex.getProviderId(),
            "runningJobId", ex.getRunningJobId()));
    }
    
    @ExceptionHandler(ConnectivityException.class)
    public ResponseEntity<ErrorResponse> handleConnectivity(
            ConnectivityException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.SERVICE_UNAVAILABLE, request, Map.of("provider", ex.getProviderName()));
    }
    
    @ExceptionHandler(InventoryException.class)
    public ResponseEntity<ErrorResponse> handleInventoryException(
            InventoryException ex, HttpServletRequest request) {
        return respond(ex, statusFor(ex.getErrorCode()), request, null);
    }
    
    // ==================== Framework Exceptions ====================
    
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(
            DataAccessException ex, HttpServletRequest request) {
        String traceId = traceId();
        log.error("[{}] Database error on {}: {}", traceId, request.getRequestURI(), ex.getMessage(), ex);
        
        ErrorResponse body = ErrorResponse.of(ErrorCode.DATABASE_ERROR, ErrorCode.DATABASE_ERROR.getDefaultMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR, request.getRequestURI(), traceId)
            .detail(ex.getMostSpecificCause().getMessage())
            .build();
        return send(ErrorCode.DATABASE_ERROR, body);
    }
    
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        return badRequest(ErrorCode.MISSING_REQUIRED_FIELD, HttpStatus.BAD_REQUEST,
            "Missing required parameter: " + ex.getParameterName(), request);
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return badRequest(ErrorCode.INVALID_FIELD_VALUE, HttpStatus.BAD_REQUEST,
            String.format("Invalid value for '%s': %s", ex.getName(), ex.getValue()), request);
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return badRequest(ErrorCode.INVALID_REQUEST, HttpStatus.METHOD_NOT_ALLOWED,
            String.format("Method %s not supported on %s", ex.getMethod(), request.getRequestURI()), request);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        String traceId = traceId();
        log.error("[{}] Unexpected error on {}: {}", traceId, request.getRequestURI(), ex.getMessage(), ex);
        
        ErrorResponse body = ErrorResponse.of(ErrorCode.UNEXPECTED_ERROR, ErrorCode.UNEXPECTED_ERROR.getDefaultMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR, request.getRequestURI(), traceId)
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .build();
        return send(ErrorCode.UNEXPECTED_ERROR, body);
    }
    
    // ==================== Helpers ====================
    
    private ResponseEntity<ErrorResponse> respond(
            InventoryException ex, HttpStatus status, HttpServletRequest request, Map<String, Object> metadata) {
        String traceId = traceId();
        ErrorCode errorCode = ex.getErrorCode();
        
        if (errorCode.isFatal()) {
            log.error("[{}] {} {}: {}", traceId, errorCode.getCode(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} {}: {}", traceId, errorCode.getCode(), request.getRequestURI(), ex.getMessage());
        }
        
        ErrorResponse body = ErrorResponse.of(errorCode, ex.getMessage(), status, request.getRequestURI(), traceId)
            .metadata(metadata)
            .build();
        return send(errorCode, body);
    }
    
    private ResponseEntity<ErrorResponse> badRequest(
            ErrorCode errorCode, HttpStatus status, String message, HttpServletRequest request) {
        String traceId = traceId();
        log.warn("[{}] Rejected request: {}", traceId, message);
        return send(errorCode, ErrorResponse.of(errorCode, message, status, request.getRequestURI(), traceId).build());
    }
    
    private ResponseEntity<ErrorResponse> send(ErrorCode errorCode, ErrorResponse body) {
        metricsRegistry.incrementCounter("inventory.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
        return ResponseEntity.status(body.getStatus()).body(body);
    }
    
    private String traceId() {
        String traceId = MDC.get("traceId");
        return traceId != null ? traceId : UUID.randomUUID().toString().substring(0, 8);
    }
    
    private HttpStatus statusFor(ErrorCode errorCode) {
        return switch (errorCode) {
            case PROVIDER_NOT_FOUND, JOB_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RECONCILIATION_IN_PROGRESS -> HttpStatus.CONFLICT;
            case INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE -> HttpStatus.BAD_REQUEST;
            case PROVIDER_UNREACHABLE, PROVIDER_AUTH_FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
