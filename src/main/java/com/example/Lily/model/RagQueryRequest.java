package com.example.Lily.model;

/**
 * Similarity search request.
 *
 * @param question text to embed
 * @param docType  kb_documents.doc_type to search in, e.g. "repairs" or "blogs"
 * @param topK     optional override for the number of nearest documents
 * @param minScore optional override for the minimum score preference
 */
public record RagQueryRequest(
        String question,
        String docType,
        Integer topK,
        Double minScore
) {
    public int resolveTopK(int defaultValue) {
        return topK == null || topK <= 0 ? defaultValue : topK;
    }

    public double resolveMinScore(double defaultValue) {
        return minScore == null ? defaultValue : minScore;
    }
}
