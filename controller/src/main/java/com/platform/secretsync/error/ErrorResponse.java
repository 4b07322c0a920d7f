package com.platform.secretsync.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by the HTTP API.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Unique error code (e.g., SS-901).
     */
    private String code;

    private String message;

    private String detail;

    /**
     * Whether retrying the same request can succeed.
     */
    private boolean fatal;

    private int status;

    private Instant timestamp;

    private String path;

    private String traceId;

    private Map<String, Object> metadata;

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
