package com.alleato.insights.repository;

import com.alleato.insights.model.Insight;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface InsightRepository {
    List<Insight> saveAll(List<Insight> insights);
    boolean existsByDocumentId(UUID documentId);
    List<Insight> findByDocumentId(UUID documentId);
    int deleteByDocumentId(UUID documentId);
    Optional<Insight> markResolved(UUID insightId, boolean resolved);
}
