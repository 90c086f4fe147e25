package com.alleato.insights.extraction;

import com.alleato.insights.model.Document;
import com.alleato.insights.model.Insight;
import com.alleato.insights.model.InsightSeverity;
import com.alleato.insights.model.InsightType;
import com.alleato.insights.service.ProjectResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns model drafts into storable insights: validates each draft, stamps the date the
 * document's event took place and links a project where one can be resolved.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InsightAssembler {

    static final int MAX_TITLE_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final double DEFAULT_CONFIDENCE = 0.7;

    public static final String SOURCE_TITLE = "title";
    public static final String SOURCE_CONTENT = "content";
    public static final String SOURCE_OCCURRED_AT = "occurred_at";
    public static final String SOURCE_CREATED_AT = "created_at";

    private final DocumentDateExtractor dateExtractor;
    private final ProjectResolver projectResolver;

    record DocumentDate(LocalDate date, String source) {

        boolean lowConfidence() {
            return SOURCE_CREATED_AT.equals(source);
        }
    }

    public List<Insight> assemble(Document document, List<InsightDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            return List.of();
        }

        DocumentDate documentDate = resolveDocumentDate(document);
        if (documentDate.lowConfidence()) {
            log.warn("Doc {}: no event date found, falling back to created_at {}", document.id(), documentDate.date());
        }

        List<Insight> insights = new ArrayList<>();
        for (InsightDraft draft : drafts) {
            toInsight(document, draft, documentDate).ifPresent(insights::add);
        }

        log.debug("Doc {}: {} of {} drafts accepted", document.id(), insights.size(), drafts.size());
        return insights;
    }

    DocumentDate resolveDocumentDate(Document document) {
        Optional<LocalDate> fromTitle = dateExtractor.extract(document.title());
        if (fromTitle.isPresent()) {
            return new DocumentDate(fromTitle.get(), SOURCE_TITLE);
        }

        Optional<LocalDate> fromContent = dateExtractor.extract(document.content());
        if (fromContent.isPresent()) {
            return new DocumentDate(fromContent.get(), SOURCE_CONTENT);
        }

        if (document.occurredAt() != null) {
            return new DocumentDate(document.occurredAt().toLocalDate(), SOURCE_OCCURRED_AT);
        }

        LocalDate created = document.createdAt() != null
            ? document.createdAt().toLocalDate()
            : LocalDate.now(ZoneOffset.UTC);
        return new DocumentDate(created, SOURCE_CREATED_AT);
    }

    private Optional<Insight> toInsight(Document document, InsightDraft draft, DocumentDate documentDate) {
        if (isBlank(draft.title()) || isBlank(draft.description())) {
            log.debug("Doc {}: dropping draft without title or description", document.id());
            return Optional.empty();
        }

        Optional<InsightType> type = isBlank(draft.type())
            ? Optional.of(InsightType.ACTION_ITEM)
            : InsightType.fromLabel(draft.type());
        if (type.isEmpty()) {
            log.debug("Doc {}: dropping draft with unknown type '{}'", document.id(), draft.type());
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(Insight.DATE_SOURCE, documentDate.source());
        if (documentDate.lowConfidence()) {
            metadata.put(Insight.DATE_LOW_CONFIDENCE, true);
        }
        if (document.title() != null) {
            metadata.put("document_title", document.title());
        }

        return Optional.of(new Insight(
            null,
            document.id(),
            resolveProject(document, draft),
            type.get(),
            truncate(draft.title().strip(), MAX_TITLE_LENGTH),
            truncate(draft.description().strip(), MAX_DESCRIPTION_LENGTH),
            InsightSeverity.fromLabel(draft.severity()),
            clampConfidence(draft.confidenceScore()),
            isBlank(draft.assignee()) ? null : draft.assignee().strip(),
            parseDueDate(draft.dueDate()),
            parseAmount(draft.financialImpact()),
            draft.businessImpact(),
            draft.exactQuotes() != null ? draft.exactQuotes() : List.of(),
            draft.stakeholdersAffected() != null ? draft.stakeholdersAffected() : List.of(),
            false,
            documentDate.date(),
            metadata,
            null
        ));
    }

    private UUID resolveProject(Document document, InsightDraft draft) {
        if (!isBlank(draft.projectMention())) {
            Optional<UUID> mentioned = projectResolver.resolve(draft.projectMention());
            if (mentioned.isPresent()) {
                return mentioned.get();
            }
        }
        if (document.projectId() != null) {
            return document.projectId();
        }
        return projectResolver.resolve(document.title()).orElse(null);
    }

    static double clampConfidence(Double score) {
        if (score == null || score.isNaN()) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    static LocalDate parseDueDate(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.strip());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static BigDecimal parseAmount(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return new BigDecimal(value.replace("$", "").replace(",", "").strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
