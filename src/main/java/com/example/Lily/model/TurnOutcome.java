package com.example.Lily.model;

import java.util.List;

/**
 * What a committed turn produced.
 *
 * @param sessionId    conversation the turn belongs to
 * @param question     user query
 * @param answer       committed agent answer
 * @param commitReason why this candidate was committed
 * @param rounds       number of drafts produced (1 + retries)
 * @param analysis     analyzer verdict the turn ran with
 * @param evidence     every tool result gathered, synthetic feedback included
 * @param prompt       the drafter prompt of the committed round
 */
public record TurnOutcome(
        String sessionId,
        String question,
        String answer,
        CommitReason commitReason,
        int rounds,
        QueryAnalysis analysis,
        List<ToolResult> evidence,
        String prompt
) {
    public boolean lowConfidence() {
        return commitReason.lowConfidence();
    }
}
