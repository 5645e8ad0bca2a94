package com.llmrelay.relay_backend.model.domain;

/**
 * The completion backends this service can front.
 * Exactly one is active per process, chosen by {@code relay.provider}.
 */
public enum ProviderType {

    OPENAI("openai",   "OpenAI-compatible chat completions"),
    BEDROCK("bedrock", "AWS Bedrock (Anthropic messages)"),
    MOCK("mock",       "Mock provider (no external API)");

    private final String id;
    private final String displayName;

    ProviderType(String id, String displayName) {
        this.id          = id;
        this.displayName = displayName;
    }

    public String getId()          { return id; }
    public String getDisplayName() { return displayName; }

    /** Unrecognised or blank values fall back to OPENAI, matching the historical default. */
    public static ProviderType fromId(String value) {
        if (value == null || value.isBlank()) return OPENAI;
        for (ProviderType t : values()) {
            if (t.id.equalsIgnoreCase(value.trim()) || t.name().equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        return OPENAI;
    }
}
