package com.example.Lily.model;

public record ResetResponse(
        String message,
        String introduction
) {
}
