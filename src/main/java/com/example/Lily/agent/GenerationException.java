package com.example.Lily.agent;

/**
 * Drafter model call failed or timed out. Fatal to the turn: nothing is committed.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
