package com.llmrelay.relay_backend.model.usage;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** One line of the dispatcher's conversation log. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationEntry(Instant timestamp,
                                String fromRole,
                                String toRole,
                                String message,
                                boolean aiGenerated,
                                String model,
                                Integer tokens) {

    public static ConversationEntry outgoing(String from, String to, String message) {
        return new ConversationEntry(Instant.now(), from, to, message, false, null, null);
    }

    public static ConversationEntry reply(String from, String to, String message, String model, int tokens) {
        return new ConversationEntry(Instant.now(), from, to, message, true, model, tokens);
    }
}
