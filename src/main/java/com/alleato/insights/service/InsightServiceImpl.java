package com.alleato.insights.service;

import com.alleato.insights.exception.EntityNotFoundException;
import com.alleato.insights.model.Insight;
import com.alleato.insights.repository.DocumentRepository;
import com.alleato.insights.repository.InsightRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class InsightServiceImpl implements InsightService {

    private final InsightRepository insightRepository;
    private final DocumentRepository documentRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean hasInsights(UUID documentId) {
        return insightRepository.existsByDocumentId(documentId);
    }

    @Override
    @Transactional
    public int store(UUID documentId, List<Insight> insights, boolean replaceExisting) {
        if (replaceExisting) {
            int removed = insightRepository.deleteByDocumentId(documentId);
            log.info("Doc {}: removed {} previous insights before reprocessing", documentId, removed);
        }
        if (insights.isEmpty()) {
            return 0;
        }

        int saved = insightRepository.saveAll(insights).size();
        log.info("Doc {}: stored {} insights", documentId, saved);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Insight> findByDocumentId(UUID documentId) {
        if (documentRepository.findById(documentId).isEmpty()) {
            log.warn("Document not found with ID: {}", documentId);
            throw new EntityNotFoundException("Document", documentId);
        }
        return insightRepository.findByDocumentId(documentId);
    }

    @Override
    @Transactional
    public Insight markResolved(UUID insightId, boolean resolved) {
        return insightRepository.markResolved(insightId, resolved)
            .orElseThrow(() -> {
                log.warn("Insight not found with ID: {}", insightId);
                return new EntityNotFoundException("Insight", insightId);
            });
    }
}
