package com.llmrelay.relay_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageDto(int promptTokens, int completionTokens, int totalTokens, double estimatedCost) {
}
