package com.alleato.insights.service;

import com.alleato.insights.model.ChunkSearchResult;
import com.alleato.insights.model.SearchFilters;

import java.util.List;

public interface SearchService {

    /**
     * Chunks whose similarity to the query is strictly above {@code threshold}, best first.
     * {@code null} threshold or limit fall back to the configured defaults.
     */
    List<ChunkSearchResult> search(float[] queryEmbedding, Double threshold, Integer limit, SearchFilters filters);

    List<ChunkSearchResult> searchText(String query, Double threshold, Integer limit, SearchFilters filters);
}
