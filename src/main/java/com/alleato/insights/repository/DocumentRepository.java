package com.alleato.insights.repository;

import com.alleato.insights.model.Document;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentRepository {

    Document save(Document document);

    Optional<Document> findById(UUID id);

    /**
     * Documents that have no insights and no pending, processing or completed queue
     * entry. Content is cut to {@code sampleChars}.
     */
    List<Document> findUnprocessed(int sampleChars);
}
