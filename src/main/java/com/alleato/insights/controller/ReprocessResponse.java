package com.alleato.insights.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record ReprocessResponse(
    @JsonProperty("document_id") UUID documentId,
    boolean queued
) {}
