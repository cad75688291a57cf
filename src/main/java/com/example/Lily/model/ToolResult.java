package com.example.Lily.model;

/**
 * Normalized outcome of one retrieval call, or of feedback folded back into the evidence set.
 *
 * @param sourceTool tool name, or {@link #JUDGE_SOURCE} for synthetic feedback
 * @param payload    text or a structured record (list/map) returned by the tool
 * @param kind       external retrieval or synthetic injection
 * @param failed     true when payload is a failure marker instead of data
 */
public record ToolResult(
        String sourceTool,
        Object payload,
        ToolResultKind kind,
        boolean failed
) {
    public static final String JUDGE_SOURCE = "judge";

    public static ToolResult external(String sourceTool, Object payload) {
        return new ToolResult(sourceTool, payload, ToolResultKind.EXTERNAL, false);
    }

    public static ToolResult failure(String sourceTool, String reason) {
        return new ToolResult(sourceTool, "Error calling " + sourceTool + ": " + reason, ToolResultKind.EXTERNAL, true);
    }

    public static ToolResult judgeFeedback(String feedback) {
        return new ToolResult(JUDGE_SOURCE, feedback, ToolResultKind.SYNTHETIC, false);
    }

    public boolean isSynthetic() {
        return kind == ToolResultKind.SYNTHETIC;
    }
}
