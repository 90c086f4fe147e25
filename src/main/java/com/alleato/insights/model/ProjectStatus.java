package com.alleato.insights.model;

public enum ProjectStatus {
    ACTIVE,
    COMPLETED,
    ON_HOLD,
    CANCELLED
}
