package com.llmrelay.relay_backend.model.dto;

public record ConfigResponse(String provider, String defaultModel, double temperature, int maxTokens) {
}
