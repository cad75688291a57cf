package com.example.Lily.model;

public enum MessageRole {
    USER,
    AGENT
}
