package com.llmrelay.relay_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.llmrelay.relay_backend.error.ErrorKind;

/**
 * Failure payload: what went wrong, classified, and whether the caller may retry.
 * No stack traces or raw exceptions cross the wire.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureResponse(String status, ErrorDetail error, String timestamp) {

    public static final String ERROR = "error";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorDetail(String type, String message, boolean retryable, Integer upstreamStatus) {
    }

    public static FailureResponse of(ErrorKind kind, String message, Integer upstreamStatus, String timestamp) {
        return new FailureResponse(ERROR, new ErrorDetail(kind.name(), message, kind.isRetryable(), upstreamStatus), timestamp);
    }
}
