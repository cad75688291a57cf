package com.example.Lily.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * One exchanged message in a conversation.
 *
 * role         - who wrote it
 * content      - message text
 * timestamp    - epoch millis of creation
 * commitReason - only set on agent messages, tells how the answer got committed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
        MessageRole role,
        String content,
        long timestamp,
        CommitReason commitReason
) {

    public static Message user(String content) {
        return new Message(MessageRole.USER, content, Instant.now().toEpochMilli(), null);
    }

    public static Message agent(String content, CommitReason commitReason) {
        return new Message(MessageRole.AGENT, content, Instant.now().toEpochMilli(), commitReason);
    }

    public boolean lowConfidence() {
        return commitReason != null && commitReason.lowConfidence();
    }
}
