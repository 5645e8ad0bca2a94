package com.llmrelay.relay_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/** Success payload of a completion. {@code processingTime} is in seconds, three decimals. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessResponse(
        String status,
        String aiResponse,
        String model,
        UsageDto usage,
        String timestamp,
        double processingTime,
        String provider
) {
    public static final String SUCCESS = "success";
}
