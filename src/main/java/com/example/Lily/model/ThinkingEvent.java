package com.example.Lily.model;

/**
 * A single step event streamed to the client while a turn is processed.
 *
 * stage   - pipeline stage name, e.g. "analysis", "retrieval", "answer_delta", "answer_final"
 * message - human-readable description of what this step means
 * payload - arbitrary payload for UI, e.g.:
 *           - Map with analysis or validation verdicts
 *           - List of tool result summaries
 *           - String for answer token delta
 *           - Map with the committed answer and its commit reason
 */
public record ThinkingEvent(
        String stage,
        String message,
        Object payload
) {
    public static final String START = "start";
    public static final String ANALYSIS = "analysis";
    public static final String RETRIEVAL = "retrieval";
    public static final String ANSWER_DELTA = "answer_delta";
    public static final String VALIDATION = "validation";
    public static final String RETRY = "retry";
    public static final String ANSWER_FINAL = "answer_final";
    public static final String ERROR = "error";

    public static ThinkingEvent error(String message) {
        return new ThinkingEvent(ERROR, message, null);
    }
}
