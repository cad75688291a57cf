package com.example.Lily.agent;

/**
 * A query arrived for a session that is still answering the previous one.
 */
public class TurnInProgressException extends RuntimeException {

    private final String sessionId;

    public TurnInProgressException(String sessionId) {
        super("A turn is already in progress for session " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
