package com.alleato.insights.repository;

import com.alleato.insights.model.ChunkSearchResult;
import com.alleato.insights.model.DocumentChunk;
import com.alleato.insights.model.NewChunk;
import com.alleato.insights.model.SearchFilters;

import java.util.List;
import java.util.UUID;

public interface DocumentChunkRepository {

    /**
     * Replaces every chunk of the document. Chunk {@code i} of the list is stored with
     * index {@code i}. Nothing is written if any embedding has the wrong dimension.
     *
     * @return number of chunks stored
     */
    int replaceChunks(UUID documentId, List<NewChunk> chunks);

    List<DocumentChunk> findByDocumentId(UUID documentId);

    List<ChunkSearchResult> findSimilar(float[] queryEmbedding, double threshold, int limit, SearchFilters filters);
}
