package com.example.Lily.history;

import com.example.Lily.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Copy-on-write history: readers always get an immutable list that was complete when published.
 */
public class InMemoryConversationHistory implements ConversationHistory {

    private final Object writeLock = new Object();
    private volatile List<Message> messages = List.of();

    @Override
    public void append(Message message) {
        appendAll(List.of(message));
    }

    @Override
    public void appendAll(List<Message> toAppend) {
        Objects.requireNonNull(toAppend, "toAppend");
        if (toAppend.isEmpty()) {
            return;
        }
        synchronized (writeLock) {
            List<Message> next = new ArrayList<>(messages.size() + toAppend.size());
            next.addAll(messages);
            for (Message message : toAppend) {
                next.add(Objects.requireNonNull(message, "message"));
            }
            messages = List.copyOf(next);
        }
    }

    @Override
    public List<Message> snapshot() {
        return messages;
    }

    @Override
    public void reset() {
        synchronized (writeLock) {
            messages = List.of();
        }
    }
}
