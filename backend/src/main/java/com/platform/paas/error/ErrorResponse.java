package com.platform.paas.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standardized error response model.
 * All API errors, admission rejections included, return this structure.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Unique error code (e.g., CP-601).
     */
    private String code;
    
    private String message;
    
    /**
     * Detailed description for debugging.
     */
    private String detail;
    
    /**
     * Whether this error requires intervention or the caller can retry or fix the request.
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    private String path;
    
    /**
     * Correlation ID for matching the response with controller logs.
     */
    private String traceId;
    
    private List<FieldError> fieldErrors;
    
    /**
     * Additional error metadata, e.g. the rejected dimension and its limit.
     */
    private Map<String, Object> metadata;
    
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
    
    public static ErrorResponse of(ErrorCode errorCode, String message, int status, String path, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status)
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId)
            .build();
    }
}
