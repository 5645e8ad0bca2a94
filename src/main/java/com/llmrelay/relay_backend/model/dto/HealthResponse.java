package com.llmrelay.relay_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        String status,
        String server,
        String timestamp,
        long messagesProcessed,
        String provider,
        AiStatus ai
) {
    public static final String HEALTHY  = "healthy";
    public static final String DEGRADED = "degraded";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AiStatus(boolean configured, String status, String error, String note) {
    }
}
