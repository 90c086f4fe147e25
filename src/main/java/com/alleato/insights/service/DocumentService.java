package com.alleato.insights.service;

import com.alleato.insights.controller.DocumentRequest;
import com.alleato.insights.controller.DocumentResponse;

import java.util.UUID;

public interface DocumentService {
    DocumentResponse ingest(DocumentRequest request);
    DocumentResponse getById(UUID id);
}
