package com.example.Lily.model;

/**
 * Why a turn's final candidate answer was committed.
 */
public enum CommitReason {
    /** Judge accepted the answer. */
    ACCEPTED,
    /** Judge call failed or returned garbage; answer committed fail-open. */
    VALIDATION_FALLBACK,
    /** Judge rejected the answer without usable feedback. */
    NON_ACTIONABLE_REJECTION,
    /** Judge rejected the last allowed draft. */
    RETRY_BUDGET_EXHAUSTED;

    public boolean lowConfidence() {
        return this == NON_ACTIONABLE_REJECTION || this == RETRY_BUDGET_EXHAUSTED;
    }
}
