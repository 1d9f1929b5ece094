package com.campussecurity.dispatch.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Stable code for programmatic handling, e.g. UNKNOWN_OR_INACTIVE_BEACON.
     */
    private String errorCode;

    private String message;

    private int status;

    @Builder.Default
    private Instant timestamp = Instant.now();

    private String path;

    /**
     * Present on 400 responses from request validation.
     */
    private List<FieldError> fieldErrors;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldError {
        private String field;
        private String rejectedValue;
        private String message;
    }
}
