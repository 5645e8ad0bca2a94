package com.llmrelay.relay_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of a completion request on the wire. Null model, temperature or maxTokens mean
 * "use the responder's configured default".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessRequest(
        @NotBlank @Size(max = 10_000) String message,
        @Size(max = 5_000) String context,
        String model,
        @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
        @JsonAlias("max_tokens") @Min(1) @Max(4_000) Integer maxTokens
) {

    public static ProcessRequest of(String message) {
        return new ProcessRequest(message, null, null, null, null);
    }
}
