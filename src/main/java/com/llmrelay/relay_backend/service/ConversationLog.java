package com.llmrelay.relay_backend.service;

import com.llmrelay.relay_backend.model.usage.ConversationEntry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Append-only, unbounded log of what the dispatcher sent and received. */
public class ConversationLog {

    private final List<ConversationEntry> entries = new CopyOnWriteArrayList<>();

    public void append(ConversationEntry entry) {
        entries.add(entry);
    }

    /** Both entries of one exchange become visible together. */
    public synchronized void appendExchange(ConversationEntry outgoing, ConversationEntry reply) {
        entries.addAll(List.of(outgoing, reply));
    }

    public List<ConversationEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
