package com.example.Lily.tools;

import com.example.Lily.model.ToolCall;

import java.util.Map;
import java.util.Optional;

/**
 * A retrieval tool the dispatcher can run. Implementations may block; the dispatcher
 * runs them off the caller's thread and enforces the timeout.
 */
public interface RetrievalTool extends AiToolDefinition {

    /**
     * @return text or a structured record; null means "nothing found"
     * @throws RetrievalException if the arguments are unusable or the backend fails
     */
    Object execute(Map<String, Object> arguments);

    /**
     * Call to issue when retrieval is required but the analyzer proposed nothing usable.
     */
    default Optional<ToolCall> defaultCall(String query) {
        return Optional.empty();
    }

    static String stringArg(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
