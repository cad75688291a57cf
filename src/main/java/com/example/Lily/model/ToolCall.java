package com.example.Lily.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single retrieval request: which tool to run and with which arguments.
 * Null-valued arguments are dropped.
 */
public record ToolCall(
        String toolName,
        Map<String, Object> arguments
) {
    public ToolCall {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (arguments != null) {
            arguments.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        arguments = Collections.unmodifiableMap(copy);
    }
}
