package com.alleato.insights.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One insight as returned by the extraction model, before validation. Every field may be
 * missing or malformed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightDraft(
    @JsonProperty("insight_type") String type,
    String title,
    String description,
    @JsonProperty("business_impact") String businessImpact,
    String severity,
    @JsonProperty("confidence_score") Double confidenceScore,
    String assignee,
    @JsonProperty("due_date") String dueDate,
    @JsonProperty("financial_impact") String financialImpact,
    @JsonProperty("project") String projectMention,
    @JsonProperty("stakeholders_affected") List<String> stakeholdersAffected,
    @JsonProperty("exact_quotes") List<String> exactQuotes
) {}
