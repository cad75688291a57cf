package com.example.Lily.model;

/**
 * Judge verdict for one candidate answer.
 */
public record ResponseValidation(
        boolean accepted,
        boolean inScope,
        boolean hallucinationDetected,
        boolean appropriate,
        String feedback,
        boolean fallback
) {

    /**
     * Fold the three independent checks into one verdict.
     */
    public static ResponseValidation of(boolean inScope, boolean hallucinationDetected, boolean appropriate, String feedback) {
        boolean accepted = inScope && !hallucinationDetected && appropriate;
        return new ResponseValidation(accepted, inScope, hallucinationDetected, appropriate, feedback, false);
    }

    /**
     * Used when the judge itself is broken: accept, but keep the fact visible.
     */
    public static ResponseValidation failOpen() {
        return new ResponseValidation(true, true, false, true, null, true);
    }

    public boolean hasActionableFeedback() {
        return feedback != null && !feedback.isBlank();
    }
}
