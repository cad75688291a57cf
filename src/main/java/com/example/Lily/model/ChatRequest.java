package com.example.Lily.model;

import java.util.Set;

/**
 * Request payload for the chat and regenerate endpoints.
 *
 * @param query     user question (optional for regenerate)
 * @param sessionId conversation id; blank means the shared default conversation
 * @param model     optional model name hint for drafting (e.g. "deepseek", "openai")
 */
public record ChatRequest(
        String query,
        String sessionId,
        String model
) {
    private static final Set<String> models = Set.of("deepseek", "openai");
    public static final String DEFAULT_MODEL = "deepseek";
    public static final String DEFAULT_SESSION = "default";

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }

    /**
     * Returns the requested model if it is a known one, otherwise null so the configured role model applies.
     */
    public String resolveModel() {
        return (model == null || model.isBlank()
                || !models.contains(model.toLowerCase())) ? null : model.toLowerCase();
    }

    public String resolveSessionId() {
        return sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION : sessionId.trim();
    }
}
