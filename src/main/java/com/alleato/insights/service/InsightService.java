package com.alleato.insights.service;

import com.alleato.insights.model.Insight;

import java.util.List;
import java.util.UUID;

public interface InsightService {
    boolean hasInsights(UUID documentId);
    int store(UUID documentId, List<Insight> insights, boolean replaceExisting);
    List<Insight> findByDocumentId(UUID documentId);
    Insight markResolved(UUID insightId, boolean resolved);
}
