package com.example.Lily.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON object out of a model reply that was asked to answer in JSON only.
 * Models still wrap it in markdown fences or add a sentence around it now and then.
 */
public final class JsonReplyParser {

    private JsonReplyParser() {
    }

    /**
     * Pattern for fenced blocks: ```json ... ``` or ``` ... ```
     */
    private static final Pattern FENCED = Pattern.compile(
            "```(?:json)?\\s*(.*?)\\s*```",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE
    );

    public static Optional<String> extractObject(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        Matcher matcher = FENCED.matcher(trimmed);
        if (matcher.find()) {
            trimmed = matcher.group(1).trim();
        }

        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(trimmed.substring(start, end + 1));
    }

    /**
     * Read a boolean field, accepting JSON booleans and "true"/"false" strings.
     */
    public static Optional<Boolean> readBoolean(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isBoolean()) {
            return Optional.of(value.booleanValue());
        }
        if (value.isTextual()) {
            String text = value.textValue().trim();
            if ("true".equalsIgnoreCase(text)) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equalsIgnoreCase(text)) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    public static String readText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.textValue().trim() : value.toString();
    }
}
