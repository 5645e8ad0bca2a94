package com.llmrelay.relay_backend.service;

import com.llmrelay.relay_backend.model.usage.ConversationEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationLogTest {

    @Test
    void appendExchange_keepsOutgoingBeforeReply() {
        ConversationLog log = new ConversationLog();
        log.appendExchange(
                ConversationEntry.outgoing("messenger", "responder", "hello"),
                ConversationEntry.reply("responder", "messenger", "hi!", "gpt-4", 12));

        List<ConversationEntry> entries = log.entries();
        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).aiGenerated()).isFalse();
        assertThat(entries.get(0).model()).isNull();
        assertThat(entries.get(1).aiGenerated()).isTrue();
        assertThat(entries.get(1).tokens()).isEqualTo(12);
    }

    @Test
    void entries_isAReadOnlyCopy() {
        ConversationLog log = new ConversationLog();
        log.append(ConversationEntry.outgoing("a", "b", "x"));

        List<ConversationEntry> entries = log.entries();
        log.append(ConversationEntry.outgoing("a", "b", "y"));

        assertThat(entries).hasSize(1);
        assertThat(log.size()).isEqualTo(2);
        assertThatThrownBy(() -> entries.add(ConversationEntry.outgoing("a", "b", "z")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
