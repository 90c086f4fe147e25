package com.alleato.insights.controller;

import com.alleato.insights.model.Insight;
import com.alleato.insights.model.InsightSeverity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

public record InsightResponse(
    UUID id,
    @JsonProperty("document_id") UUID documentId,
    @JsonProperty("project_id") UUID projectId,
    @JsonProperty("insight_type") String type,
    String title,
    String description,
    InsightSeverity severity,
    @JsonProperty("confidence_score") double confidenceScore,
    String assignee,
    @JsonProperty("due_date") LocalDate dueDate,
    @JsonProperty("financial_impact") BigDecimal financialImpact,
    @JsonProperty("business_impact") String businessImpact,
    @JsonProperty("exact_quotes") List<String> exactQuotes,
    @JsonProperty("stakeholders_affected") List<String> stakeholdersAffected,
    boolean resolved,
    @JsonProperty("document_date") LocalDate documentDate,
    Map<String, Object> metadata,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {

    static InsightResponse from(Insight insight) {
        return new InsightResponse(
            insight.id(),
            insight.documentId(),
            insight.projectId(),
            insight.type().name().toLowerCase(Locale.ROOT),
            insight.title(),
            insight.description(),
            insight.severity(),
            insight.confidenceScore(),
            insight.assignee(),
            insight.dueDate(),
            insight.financialImpact(),
            insight.businessImpact(),
            insight.exactQuotes(),
            insight.stakeholdersAffected(),
            insight.resolved(),
            insight.documentDate(),
            insight.metadata(),
            insight.createdAt()
        );
    }
}
