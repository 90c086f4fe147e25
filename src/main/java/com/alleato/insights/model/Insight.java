package com.alleato.insights.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A typed extraction from a document. Only {@code resolved} changes after insert.
 *
 * <p>{@code documentDate} is the day the underlying event happened; {@code createdAt} is
 * when the insight was extracted.
 */
public record Insight(
    UUID id,
    UUID documentId,
    UUID projectId,
    InsightType type,
    String title,
    String description,
    InsightSeverity severity,
    double confidenceScore,
    String assignee,
    LocalDate dueDate,
    BigDecimal financialImpact,
    String businessImpact,
    List<String> exactQuotes,
    List<String> stakeholdersAffected,
    boolean resolved,
    LocalDate documentDate,
    Map<String, Object> metadata,
    OffsetDateTime createdAt
) {

    public static final String DATE_SOURCE = "document_date_source";
    public static final String DATE_LOW_CONFIDENCE = "document_date_low_confidence";
}
