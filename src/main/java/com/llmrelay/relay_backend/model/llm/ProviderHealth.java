package com.llmrelay.relay_backend.model.llm;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Result of a provider health probe. Never thrown, only returned. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderHealth(String status, String error, String note) {

    public static final String HEALTHY   = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public static ProviderHealth healthy() {
        return new ProviderHealth(HEALTHY, null, null);
    }

    public static ProviderHealth healthy(String note) {
        return new ProviderHealth(HEALTHY, null, note);
    }

    public static ProviderHealth unhealthy(String error) {
        return new ProviderHealth(UNHEALTHY, error, null);
    }

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
