package com.example.Lily.model;

public record ScoredDocument(
        KbDocument document,
        double score
) {
}
