package com.example.Lily.model;

import java.util.List;

/**
 * Pure retrieval result for RAG:
 * - question: original search text
 * - docType: which document table was searched
 * - documents: filtered scored documents from vector store
 */
public record RagRetrievalResult(
        String question,
        String docType,
        List<ScoredDocument> documents
) {
    /**
     * Document texts in score order, each followed by its source link when known.
     */
    public List<String> contents() {
        return documents.stream()
                .map(ScoredDocument::document)
                .map(doc -> doc.sourceUrl() == null
                        ? doc.getContent()
                        : doc.getContent() + "\nSource: " + doc.sourceUrl())
                .toList();
    }
}
