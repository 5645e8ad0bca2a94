package com.llmrelay.relay_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderListing(
        String provider,
        List<String> models,
        @JsonProperty("default") String defaultModel,
        String note
) {
}
