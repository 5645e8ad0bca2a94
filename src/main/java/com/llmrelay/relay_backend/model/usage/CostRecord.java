package com.llmrelay.relay_backend.model.usage;

/** Estimated price of one call. Cost is in USD, rounded to six decimals. */
public record CostRecord(String model, int promptTokens, int completionTokens, double cost) {
}
