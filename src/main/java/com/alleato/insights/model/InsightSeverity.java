package com.alleato.insights.model;

import java.util.Locale;

public enum InsightSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static InsightSeverity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
