package com.example.Lily.history;

import com.example.Lily.model.Message;

import java.util.List;

/**
 * Ordered, append-only log of the messages exchanged in one conversation.
 * <p>
 * Implementations must make {@link #reset()} atomic for concurrent readers:
 * a {@link #snapshot()} either sees the full history or an empty one.
 */
public interface ConversationHistory {

    void append(Message message);

    /**
     * Append several messages as one unit, e.g. the (user, agent) pair of a committed turn.
     */
    void appendAll(List<Message> messages);

    /**
     * Read-only copy of the messages in append order.
     */
    List<Message> snapshot();

    /**
     * Clear the entire history. Calling it again on an empty history is a no-op.
     */
    void reset();
}
