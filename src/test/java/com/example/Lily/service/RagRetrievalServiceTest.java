package com.example.Lily.service;

import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.KbDocument;
import com.example.Lily.model.RagQueryRequest;
import com.example.Lily.model.RagRetrievalResult;
import com.example.Lily.model.ScoredDocument;
import com.example.Lily.repository.KbDocumentVectorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RagRetrievalServiceTest {

    private static final float[] EMBEDDING = {0.1f, 0.2f};

    private EmbeddingModel embeddingModel;
    private KbDocumentVectorRepository repository;
    private RagRetrievalService service;

    @BeforeEach
    void setUp() {
        embeddingModel = mock(EmbeddingModel.class);
        repository = mock(KbDocumentVectorRepository.class);
        when(embeddingModel.embed("leaking fridge")).thenReturn(EMBEDDING);
        service = new RagRetrievalService(embeddingModel, repository, new LilyProperties());
    }

    @Test
    void shouldKeepDocumentsCloseToTheBestMatch() {
        when(repository.findNearest(EMBEDDING, "repairs", 5)).thenReturn(List.of(
                scored("valve guide", 0.85),
                scored("filter guide", 0.78),
                scored("door guide", 0.62)
        ));

        RagRetrievalResult result = service.retrieve(new RagQueryRequest("leaking fridge", "repairs", null, null));

        assertEquals(List.of("valve guide", "filter guide"), result.contents());
        assertEquals("repairs", result.docType());
    }

    @Test
    void shouldKeepBestDocumentWhenAllScoresAreLow() {
        when(repository.findNearest(EMBEDDING, "blogs", 3)).thenReturn(List.of(
                scored("weak match", 0.20),
                scored("weaker match", 0.05)
        ));

        RagRetrievalResult result = service.retrieve(new RagQueryRequest("leaking fridge", "blogs", 3, null));

        assertEquals(List.of("weak match"), result.contents());
        verify(repository).findNearest(EMBEDDING, "blogs", 3);
    }

    @Test
    void shouldReturnEmptyResultWhenNothingIsStored() {
        when(repository.findNearest(EMBEDDING, "repairs", 5)).thenReturn(List.of());

        assertTrue(service.retrieve(new RagQueryRequest("leaking fridge", "repairs", null, null)).documents().isEmpty());
    }

    @Test
    void shouldRelaxThresholdBelowRequestedScore() {
        assertEquals(0.75, service.computeDynamicMinScore(0.60, 0.85), 1e-9);
        assertEquals(0.40, service.computeDynamicMinScore(0.60, 0.50), 1e-9);
        assertEquals(0.25, service.computeDynamicMinScore(0.60, 0.30), 1e-9);
        assertEquals(0.20, service.computeDynamicMinScore(0.60, 0.20), 1e-9);
    }

    private static ScoredDocument scored(String content, double score) {
        KbDocument doc = new KbDocument();
        doc.setContent(content);
        doc.setDocType("repairs");
        return new ScoredDocument(doc, score);
    }
}
