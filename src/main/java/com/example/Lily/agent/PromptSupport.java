package com.example.Lily.agent;

import com.example.Lily.model.Message;
import com.example.Lily.model.MessageRole;
import com.example.Lily.model.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Text rendering shared by the prompt builders of the three model roles.
 */
final class PromptSupport {

    private PromptSupport() {
    }

    /**
     * Render history text for LLM:
     *  - Take only the latest {@code window} messages
     *  - Join them as "role: content" lines
     */
    static String renderHistory(List<Message> messages, int window) {
        if (messages == null || messages.isEmpty()) {
            return "(no prior conversation)";
        }

        int size = messages.size();
        int startIdx = Math.max(0, size - window);
        return messages.subList(startIdx, size).stream()
                .map(m -> (m.role() == MessageRole.USER ? "user" : "assistant") + ": " + m.content())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Render tool results as context blocks:
     *   【source=searchRAG, kind=external, status=ok】
     *   payload...
     */
    static String renderEvidence(List<ToolResult> results, Predicate<ToolResult> filter, ObjectMapper objectMapper) {
        List<ToolResult> selected = results == null ? List.of() : results.stream().filter(filter).toList();
        if (selected.isEmpty()) {
            return "(no results)";
        }

        return selected.stream()
                .map(r -> "【source=" + r.sourceTool()
                        + ", kind=" + r.kind().name().toLowerCase()
                        + ", status=" + (r.failed() ? "failed" : "ok")
                        + "】\n"
                        + renderPayload(r.payload(), objectMapper))
                .collect(Collectors.joining("\n\n"));
    }

    static String renderPayload(Object payload, ObjectMapper objectMapper) {
        if (payload == null) {
            return "";
        }
        if (payload instanceof CharSequence text) {
            return text.toString();
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return String.valueOf(payload);
        }
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
