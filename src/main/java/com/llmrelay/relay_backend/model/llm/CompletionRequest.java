package com.llmrelay.relay_backend.model.llm;

import java.util.List;
import java.util.Optional;

/**
 * Provider-agnostic request built fresh for every call.
 * Each {@code CompletionProvider} translates it into its backend's wire format.
 */
public class CompletionRequest {

    private final List<ChatMessage> messages;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public CompletionRequest(List<ChatMessage> messages, String model, double temperature, int maxTokens) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("A completion request needs at least one message");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be within [0, 2], got " + temperature);
        }
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        this.messages    = List.copyOf(messages);
        this.model       = model;
        this.temperature = temperature;
        this.maxTokens   = maxTokens;
    }

    public List<ChatMessage> getMessages() { return messages; }
    public String getModel()               { return model; }
    public double getTemperature()         { return temperature; }
    public int getMaxTokens()              { return maxTokens; }

    /** The last system message, for backends that take it out-of-band. */
    public Optional<String> systemPrompt() {
        String system = null;
        for (ChatMessage m : messages) {
            if (m.role() == MessageRole.SYSTEM) system = m.content();
        }
        return Optional.ofNullable(system);
    }

    /** Every message except system ones, order preserved. */
    public List<ChatMessage> conversationMessages() {
        return messages.stream().filter(m -> m.role() != MessageRole.SYSTEM).toList();
    }

    /** Content of the first user message, or empty string. */
    public String firstUserMessage() {
        return messages.stream()
                .filter(m -> m.role() == MessageRole.USER)
                .map(ChatMessage::content)
                .findFirst()
                .orElse("");
    }
}
