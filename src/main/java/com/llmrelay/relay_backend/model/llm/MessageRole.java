package com.llmrelay.relay_backend.model.llm;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageRole {
    SYSTEM, USER, ASSISTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
