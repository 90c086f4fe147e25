package com.alleato.insights.controller;

import com.alleato.insights.service.InsightService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class InsightController {

    private final InsightService insightService;

    @GetMapping("/documents/{documentId}/insights")
    public ResponseEntity<List<InsightResponse>> documentInsights(@PathVariable UUID documentId) {
        return ResponseEntity.ok(insightService.findByDocumentId(documentId).stream()
            .map(InsightResponse::from)
            .toList());
    }

    @PatchMapping("/insights/{id}/resolved")
    public ResponseEntity<InsightResponse> markResolved(
        @PathVariable UUID id,
        @Valid @RequestBody ResolvedRequest request) {

        return ResponseEntity.ok(InsightResponse.from(insightService.markResolved(id, request.resolved())));
    }
}
