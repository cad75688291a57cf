package com.example.Lily.agent;

/**
 * Judge model call failed, timed out or returned an unreadable verdict.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
