package com.alleato.insights.model;

import java.util.Locale;
import java.util.Optional;

public enum InsightType {
    ACTION_ITEM,
    DECISION,
    RISK,
    MILESTONE,
    BLOCKER,
    OPPORTUNITY,
    DEPENDENCY,
    BUDGET_UPDATE,
    TIMELINE_CHANGE,
    STAKEHOLDER_FEEDBACK,
    TECHNICAL_ISSUE,
    CONCERN;

    /**
     * Accepts the snake_case labels the extraction model emits ("action_item",
     * "Budget Update", ...).
     */
    public static Optional<InsightType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        for (InsightType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
