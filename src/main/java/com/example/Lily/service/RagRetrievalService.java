package com.example.Lily.service;

import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.RagQueryRequest;
import com.example.Lily.model.RagRetrievalResult;
import com.example.Lily.model.ScoredDocument;
import com.example.Lily.repository.KbDocumentVectorRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * RAG retrieval-only service:
 * - Takes search text and the document type to search in
 * - Generates embedding
 * - Queries the vector store
 * - Applies basic filtering (with dynamic score adaptation)
 *
 * This service does NOT call any chat/LLM APIs.
 * It backs the repair/blog search tool.
 */
@Service
@RequiredArgsConstructor
public class RagRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RagRetrievalService.class);

    /**
     * Margin from the top score used for dynamic thresholding.
     * Example: if topScore = 0.82 and margin = 0.10, dynamic threshold ~0.72.
     */
    private static final double TOP_SCORE_MARGIN = 0.10;

    /**
     * Absolute lower bound when all scores are low.
     * We do not drop below this to avoid extremely noisy results.
     */
    private static final double ABSOLUTE_FLOOR_SCORE = 0.25;

    private final EmbeddingModel embeddingModel;
    private final KbDocumentVectorRepository kbRepository;
    private final LilyProperties properties;

    /**
     * Core retrieval method:
     * 1. Embed search text
     * 2. Query vector store within the requested doc type
     * 3. Compute dynamic min score
     * 4. Filter by dynamic min score
     *
     * @param request search text, doc type and optional overrides
     * @return retrieval result with the filtered documents
     */
    public RagRetrievalResult retrieve(RagQueryRequest request) {
        String question = request.question();
        float[] queryEmbedding = embeddingModel.embed(question);

        int topK = request.resolveTopK(properties.getRetrieval().getTopK());
        double requestedMinScore = request.resolveMinScore(properties.getRetrieval().getMinScore());

        List<ScoredDocument> retrieved = kbRepository.findNearest(queryEmbedding, request.docType(), topK);

        if (retrieved == null || retrieved.isEmpty()) {
            log.debug("RAG retrieval: no documents found in {} for question='{}'", request.docType(), question);
            return new RagRetrievalResult(question, request.docType(), List.of());
        }

        double topScore = retrieved.stream()
                .mapToDouble(ScoredDocument::score)
                .max()
                .orElse(0.0);

        double effectiveMinScore = computeDynamicMinScore(requestedMinScore, topScore);

        List<ScoredDocument> filtered = retrieved.stream()
                .filter(doc -> doc.score() >= effectiveMinScore)
                .toList();

        // Safety net: if everything was filtered out but we did get results,
        // keep at least the single best document.
        if (filtered.isEmpty()) {
            log.debug(
                    "RAG retrieval: all docs filtered out (topScore={}, effectiveMinScore={}). " +
                            "Keeping best document as fallback.",
                    topScore, effectiveMinScore
            );
            filtered = List.of(retrieved.get(0));
        }

        return new RagRetrievalResult(question, request.docType(), filtered);
    }

    /**
     * Compute a dynamic minimum score based on:
     *  - requested/default min score
     *  - actual topScore of the retrieved documents
     *
     * If topScore >= requestedMinScore, keep only matches close to the best one but never below
     * the requested score. Otherwise relax to topScore - margin, floored at ABSOLUTE_FLOOR_SCORE.
     */
    double computeDynamicMinScore(double requestedMinScore, double topScore) {
        double dynamicMinScore;

        if (topScore >= requestedMinScore) {
            double fromTop = topScore - TOP_SCORE_MARGIN;
            dynamicMinScore = Math.max(requestedMinScore, fromTop);
        } else {
            double relaxedFromTop = topScore - TOP_SCORE_MARGIN;
            dynamicMinScore = Math.max(ABSOLUTE_FLOOR_SCORE, relaxedFromTop);
        }

        // Never exceed topScore (corner case when margin is very small)
        if (dynamicMinScore > topScore) {
            dynamicMinScore = topScore;
        }

        return dynamicMinScore;
    }
}
