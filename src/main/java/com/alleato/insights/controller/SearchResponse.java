package com.alleato.insights.controller;

import com.alleato.insights.model.ChunkSearchResult;

import java.util.List;

public record SearchResponse(
    String query,
    List<ChunkSearchResult> results
) {}
