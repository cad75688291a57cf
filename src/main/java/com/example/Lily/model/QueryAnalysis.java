package com.example.Lily.model;

import java.util.List;

/**
 * Classification of one user query.
 *
 * @param inScope        query is about refrigerator/dishwasher parts or repairs
 * @param needsRetrieval answering requires tool calls
 * @param rationale      short model explanation, for logs and the UI
 * @param retrievalHints tool calls proposed by the analyzer, in order
 * @param fallback       true when this is the default analysis used after the analyzer failed
 */
public record QueryAnalysis(
        boolean inScope,
        boolean needsRetrieval,
        String rationale,
        List<ToolCall> retrievalHints,
        boolean fallback
) {
    public QueryAnalysis {
        rationale = rationale == null ? "" : rationale;
        retrievalHints = retrievalHints == null ? List.of() : List.copyOf(retrievalHints);
    }

    /**
     * Fail-open default: assume the query is in scope and do the retrieval.
     */
    public static QueryAnalysis failOpen() {
        return new QueryAnalysis(true, true, "analyzer unavailable, defaulting to retrieval", List.of(), true);
    }
}
