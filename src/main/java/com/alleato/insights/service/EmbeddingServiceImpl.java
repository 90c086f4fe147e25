package com.alleato.insights.service;

import com.alleato.insights.exception.EmbeddingException;
import com.alleato.insights.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Vectors for queries and chunks. Transient provider errors are retried here before the
 * queue-level retry of the whole document applies.
 */
@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    static final int MAX_QUERY_CHARS = 1000;

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;

    @Value("${app.embedding.dimension:768}")
    private int dimension;

    public EmbeddingServiceImpl(
        EmbeddingModel embeddingModel,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter
    ) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.embedding.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.embedding.retry-delay-ms:500}", multiplier = 2)
    )
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }

        String input = text.strip();
        if (input.length() > MAX_QUERY_CHARS) {
            input = input.substring(0, MAX_QUERY_CHARS);
            log.warn("Query was truncated to {} chars for embedding", MAX_QUERY_CHARS);
        }

        embeddingLimiter.acquire(EMBEDDING_LIMIT, estimateTokens(input.length()));
        float[] vector = embeddingModel.embed(input).content().vector();
        return checkDimension(vector);
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.embedding.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.embedding.retry-delay-ms:500}", multiplier = 2)
    )
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        int totalChars = texts.stream().mapToInt(String::length).sum();
        embeddingLimiter.acquire(EMBEDDING_LIMIT, estimateTokens(totalChars));

        Response<List<Embedding>> response = embeddingModel.embedAll(
            texts.stream().map(TextSegment::from).toList()
        );

        List<Embedding> embeddings = response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new EmbeddingException("Embedding count mismatch: sent %d texts, got %d vectors"
                .formatted(texts.size(), embeddings == null ? 0 : embeddings.size()));
        }

        log.debug("Embedded {} texts ({} chars)", texts.size(), totalChars);
        return embeddings.stream()
            .map(embedding -> checkDimension(embedding.vector()))
            .toList();
    }

    private float[] checkDimension(float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new EmbeddingException("Embedding model returned %s dimensions, expected %d"
                .formatted(vector == null ? "no" : String.valueOf(vector.length), dimension));
        }
        return vector;
    }

    private static int estimateTokens(int chars) {
        return Math.max(1, chars / 4);
    }
}
