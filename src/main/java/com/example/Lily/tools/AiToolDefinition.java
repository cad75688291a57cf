package com.example.Lily.tools;

import java.util.Map;

/**
 * Common metadata for a retrieval tool, shown to the analyzer so it can propose calls.
 */
public interface AiToolDefinition {
    /**
     * Unique tool name, used in tool calls.
     */
    String name();

    /**
     * Natural language description visible to the LLM.
     */
    String description();

    /**
     * Argument name to a short description of the expected value.
     */
    Map<String, String> parameters();
}
