package com.llmrelay.relay_backend.model.llm;

import java.util.Objects;

/** One turn of a conversation in provider-neutral form. */
public record ChatMessage(MessageRole role, String content) {

    public ChatMessage {
        Objects.requireNonNull(role, "role");
        content = content != null ? content : "";
    }

    public static ChatMessage system(String content)    { return new ChatMessage(MessageRole.SYSTEM, content); }
    public static ChatMessage user(String content)      { return new ChatMessage(MessageRole.USER, content); }
    public static ChatMessage assistant(String content) { return new ChatMessage(MessageRole.ASSISTANT, content); }
}
