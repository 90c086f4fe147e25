package com.alleato.insights.model;

public record ChunkSearchResult(
    DocumentChunk chunk,
    double similarity,
    ParentDocument document
) {
    public ChunkSearchResult {
        if (similarity < -0.000001 || similarity > 1.000001) {
            throw new IllegalArgumentException("Invalid similarity score: " + similarity);
        }
    }
}
