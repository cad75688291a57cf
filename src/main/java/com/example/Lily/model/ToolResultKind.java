package com.example.Lily.model;

public enum ToolResultKind {
    /** Produced by a retrieval tool. */
    EXTERNAL,
    /** Injected by the loop itself, e.g. judge feedback driving a retry. */
    SYNTHETIC
}
