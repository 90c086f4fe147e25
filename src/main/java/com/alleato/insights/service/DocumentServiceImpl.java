package com.alleato.insights.service;

import com.alleato.insights.controller.DocumentRequest;
import com.alleato.insights.controller.DocumentResponse;
import com.alleato.insights.event.DocumentIngestedEvent;
import com.alleato.insights.exception.EntityNotFoundException;
import com.alleato.insights.model.Document;
import com.alleato.insights.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final DocumentRepository documentRepository;
    private final ProjectResolver projectResolver;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Stores the document and announces it. Classification and queueing run after commit,
     * so a rolled-back insert never reaches the queue.
     */
    @Override
    @Transactional
    public DocumentResponse ingest(DocumentRequest request) {
        log.debug("Ingesting document: {}", request.title());

        UUID projectId = request.projectId();
        if (projectId == null && request.projectMention() != null) {
            projectId = projectResolver.resolve(request.projectMention()).orElse(null);
        }

        Document saved = documentRepository.save(new Document(
            null,
            request.title(),
            request.content(),
            request.source(),
            request.category(),
            request.occurredAt(),
            projectId,
            request.participants(),
            null,
            request.metadata(),
            null,
            null
        ));

        eventPublisher.publishEvent(new DocumentIngestedEvent(saved.id()));
        log.info("Stored document {} ('{}')", saved.id(), saved.title());
        return mapToResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentResponse getById(UUID id) {
        log.debug("Fetching document by ID: {}", id);

        return documentRepository.findById(id)
            .map(this::mapToResponse)
            .orElseThrow(() -> {
                log.warn("Document not found with ID: {}", id);
                return new EntityNotFoundException("Document", id);
            });
    }

    private DocumentResponse mapToResponse(Document doc) {
        return new DocumentResponse(
            doc.id(),
            doc.title(),
            doc.content(),
            doc.source(),
            doc.category(),
            doc.occurredAt(),
            doc.projectId(),
            doc.participants(),
            doc.summary(),
            doc.metadata(),
            doc.createdAt()
        );
    }
}
