package com.alleato.insights.chunking;

/**
 * A piece of a document before it is embedded. Times are seconds from the start of the
 * recording and are {@code null} when the transcript carries no timestamps.
 */
public record ChunkDraft(
    String content,
    String speaker,
    Double startTime,
    Double endTime
) {}
