package com.alleato.insights.service;

import com.alleato.insights.model.Document;

public interface ChunkIndexingService {

    /**
     * Chunks and embeds the document, then replaces its stored chunks.
     *
     * @return number of chunks stored
     */
    int reindex(Document document);
}
