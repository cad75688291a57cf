package com.example.Lily.tools;

/**
 * A retrieval tool could not produce a result for one call.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
