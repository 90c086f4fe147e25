package com.alleato.insights.extraction;

import com.alleato.insights.model.Document;

import java.util.List;

public interface InsightExtractor {

    /**
     * @throws com.alleato.insights.exception.ExtractionException when the model call fails
     *         or its answer cannot be read
     */
    List<InsightDraft> extract(Document document);
}
