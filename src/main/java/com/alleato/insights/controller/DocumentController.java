package com.alleato.insights.controller;

import com.alleato.insights.service.DocumentService;
import com.alleato.insights.service.ProcessingQueueService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;
    private final ProcessingQueueService queueService;

    @PostMapping
    public ResponseEntity<DocumentResponse> createDocument(@Valid @RequestBody DocumentRequest request) {
        DocumentResponse response = documentService.ingest(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID id) {
        return ResponseEntity.ok(documentService.getById(id));
    }

    @PostMapping("/{id}/reprocess")
    public ResponseEntity<ReprocessResponse> reprocess(@PathVariable UUID id) {
        boolean queued = queueService.forceReprocess(id);
        return ResponseEntity.status(queued ? HttpStatus.ACCEPTED : HttpStatus.OK)
            .body(new ReprocessResponse(id, queued));
    }
}
