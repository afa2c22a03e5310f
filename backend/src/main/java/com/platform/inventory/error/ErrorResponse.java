package com.platform.inventory.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Map;

/**
 * JSON body of every API error.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /** INV-xxx code, see {@link ErrorCode}. */
    private String code;
    
    private String message;
    
    /** Root cause text, only for unexpected and database failures. */
    private String detail;
    
    /** True when retrying the same request will not help. */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    private String path;
    
    /** Same id as in the server log lines for this request. */
    private String traceId;
    
    /** Provider, job or resource the error is about. */
    private Map<String, Object> metadata;
    
    static ErrorResponseBuilder of(ErrorCode errorCode, String message, HttpStatus status, String path, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId);
    }
}
