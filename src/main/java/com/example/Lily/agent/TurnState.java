package com.example.Lily.agent;

public enum TurnState {
    ANALYZING,
    RETRIEVING,
    DRAFTING,
    VALIDATING,
    COMMITTING,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMMITTING || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TurnState next) {
        if (next == FAILED || next == CANCELLED) {
            return !isTerminal();
        }
        return switch (this) {
            case ANALYZING -> next == RETRIEVING || next == DRAFTING;
            case RETRIEVING -> next == DRAFTING;
            case DRAFTING -> next == VALIDATING;
            case VALIDATING -> next == COMMITTING || next == DRAFTING;
            default -> false;
        };
    }
}
