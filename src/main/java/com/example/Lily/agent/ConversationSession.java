package com.example.Lily.agent;

import com.example.Lily.history.ConversationHistory;
import com.example.Lily.model.Message;
import com.example.Lily.model.MessageRole;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One conversation: its history plus the slot for the single turn allowed to run at a time.
 */
public class ConversationSession {

    private final String id;
    private final ConversationHistory history;
    private final AtomicReference<Turn> activeTurn = new AtomicReference<>();
    private volatile Instant lastUsed = Instant.now();

    public ConversationSession(String id, ConversationHistory history) {
        this.id = id;
        this.history = history;
    }

    /**
     * Make {@code turn} the active one. Fails if another turn is still running.
     */
    public boolean claim(Turn turn) {
        return activeTurn.compareAndSet(null, turn);
    }

    public void release(Turn turn) {
        activeTurn.compareAndSet(turn, null);
    }

    public Optional<Turn> activeTurn() {
        return Optional.ofNullable(activeTurn.get());
    }

    /**
     * Append the turn's messages unless the turn lost its slot or got cancelled in the meantime.
     */
    public synchronized boolean commit(Turn turn, List<Message> messages) {
        if (turn.isCancelled() || activeTurn.get() != turn) {
            return false;
        }
        history.appendAll(messages);
        return true;
    }

    /**
     * Cancel the running turn, if any, and clear the history.
     */
    public synchronized void reset() {
        Turn running = activeTurn.get();
        if (running != null) {
            running.cancel();
        }
        history.reset();
    }

    public void touch(Instant now) {
        lastUsed = now;
    }

    /**
     * No turn running and not used since {@code cutoff}.
     */
    public boolean isIdleSince(Instant cutoff) {
        return activeTurn.get() == null && lastUsed.isBefore(cutoff);
    }

    public Optional<String> lastUserQuery() {
        List<Message> messages = history.snapshot();
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.role() == MessageRole.USER) {
                return Optional.of(message.content());
            }
        }
        return Optional.empty();
    }

    public String id() {
        return id;
    }

    public ConversationHistory history() {
        return history;
    }
}
