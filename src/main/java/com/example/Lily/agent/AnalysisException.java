package com.example.Lily.agent;

/**
 * Analyzer model call failed, timed out or returned output that is not a query analysis.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
