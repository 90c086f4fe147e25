package com.alleato.insights.service;

import com.alleato.insights.config.SearchProperties;
import com.alleato.insights.exception.WrongQueryException;
import com.alleato.insights.model.ChunkSearchResult;
import com.alleato.insights.model.SearchFilters;
import com.alleato.insights.repository.DocumentChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchServiceImpl implements SearchService {

    private static final int MAX_LIMIT = 100;

    private final DocumentChunkRepository chunkRepository;
    private final EmbeddingService embeddingService;
    private final SearchProperties searchProperties;

    @Override
    @Transactional(readOnly = true)
    public List<ChunkSearchResult> search(float[] queryEmbedding, Double threshold, Integer limit, SearchFilters filters) {
        if (queryEmbedding == null || queryEmbedding.length == 0) {
            throw new WrongQueryException("Query embedding must not be empty");
        }

        double effectiveThreshold = threshold != null ? threshold : searchProperties.threshold();
        int effectiveLimit = limit != null ? limit : searchProperties.limit();

        if (effectiveThreshold < 0 || effectiveThreshold > 1) {
            throw new WrongQueryException("Threshold must be between 0 and 1, got " + effectiveThreshold);
        }
        if (effectiveLimit < 1 || effectiveLimit > MAX_LIMIT) {
            throw new WrongQueryException("Limit must be between 1 and " + MAX_LIMIT + ", got " + effectiveLimit);
        }
        if (filters != null && filters.occurredFrom() != null && filters.occurredTo() != null
            && filters.occurredFrom().isAfter(filters.occurredTo())) {
            throw new WrongQueryException("occurred_from must not be after occurred_to");
        }

        List<ChunkSearchResult> results = chunkRepository.findSimilar(
            queryEmbedding, effectiveThreshold, effectiveLimit, filters != null ? filters : SearchFilters.none());

        log.debug("Search returned {} chunks (threshold={}, limit={})", results.size(), effectiveThreshold, effectiveLimit);
        return results;
    }

    @Override
    public List<ChunkSearchResult> searchText(String query, Double threshold, Integer limit, SearchFilters filters) {
        if (query == null || query.isBlank()) {
            throw new WrongQueryException("Query cannot be empty");
        }
        return search(embeddingService.embed(query), threshold, limit, filters);
    }
}
