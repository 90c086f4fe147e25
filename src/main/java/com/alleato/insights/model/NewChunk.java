package com.alleato.insights.model;

/**
 * A chunk about to be written. Its index is its position in the list handed to the
 * store, so it carries none of its own.
 */
public record NewChunk(
    String content,
    String speaker,
    Double startTime,
    Double endTime,
    float[] embedding
) {}
