package com.alleato.insights.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record ProjectResolveResponse(
    String mention,
    @JsonProperty("project_id") UUID projectId
) {}
