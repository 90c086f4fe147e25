package com.alleato.insights.exception;

import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {
    private final String entity;
    private final Object entityId;

    public EntityNotFoundException(String entity, Object entityId) {
        super(entity + " not found: " + entityId);
        this.entity = entity;
        this.entityId = entityId;
    }
}
