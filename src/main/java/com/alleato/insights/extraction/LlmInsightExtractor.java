package com.alleato.insights.extraction;

import com.alleato.insights.exception.ExtractionException;
import com.alleato.insights.infra.RateLimiter;
import com.alleato.insights.model.Document;
import com.alleato.insights.model.InsightType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
@Slf4j
public class LlmInsightExtractor implements InsightExtractor {

    public static final String CHAT_LIMIT = "chat_limit";

    private static final TypeReference<List<InsightDraft>> DRAFT_LIST = new TypeReference<>() {};

    private static final String EXTRACTION_PROMPT_TEMPLATE =
        """
            Role: Business intelligence analyst for a construction and professional services firm.
            Task: Extract the most important insights from the meeting transcript below.
            Rules:
            - At most %d insights, each unique and actionable.
            - Skip meeting logistics and routine status updates.
            - Only report what the transcript supports; quote it verbatim in exact_quotes.

            For each insight return an object with:
            - insight_type: one of %s
            - title: executive summary, max 80 chars
            - description: impact and recommended action, max 300 chars
            - business_impact: effect on business objectives
            - severity: critical, high, medium or low
            - confidence_score: number between 0 and 1
            - assignee: person responsible, if named
            - due_date: YYYY-MM-DD, if a deadline is mentioned
            - financial_impact: number, if money is mentioned
            - project: project name as mentioned, if any
            - stakeholders_affected: list of people or roles
            - exact_quotes: list of supporting quotes

            Output: a JSON array only, no prose.

            Title: %s

            Transcript:
            %s
            """;

    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;
    private final ObjectMapper objectMapper;

    @Value("${app.extraction.max-content-chars:12000}")
    private int maxContentChars;

    @Value("${app.extraction.max-insights:5}")
    private int maxInsights;

    public LlmInsightExtractor(
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter,
        ObjectMapper objectMapper
    ) {
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<InsightDraft> extract(Document document) {
        String content = document.content() == null ? "" : document.content();
        if (content.isBlank()) {
            log.warn("Doc {}: content is empty, nothing to extract", document.id());
            return List.of();
        }
        if (content.length() > maxContentChars) {
            content = content.substring(0, maxContentChars) + "\n\n[Content truncated...]";
        }

        String prompt = EXTRACTION_PROMPT_TEMPLATE.formatted(maxInsights, insightTypeLabels(), document.title(), content);

        String answer;
        try {
            answer = chatLimiter.execute(CHAT_LIMIT, 1, () -> chatModel.chat(prompt));
        } catch (Exception e) {
            throw new ExtractionException("Insight extraction call failed for document " + document.id(), e);
        }

        List<InsightDraft> drafts = parse(answer, document);
        log.debug("Doc {}: model returned {} insight drafts", document.id(), drafts.size());
        return drafts.size() > maxInsights ? drafts.subList(0, maxInsights) : drafts;
    }

    List<InsightDraft> parse(String answer, Document document) {
        if (answer == null || answer.isBlank()) {
            return List.of();
        }

        // Models wrap JSON in markdown fences or add a preamble
        int start = answer.indexOf('[');
        int end = answer.lastIndexOf(']');
        if (start < 0 || end < start) {
            throw new ExtractionException("No JSON array in model answer for document " + document.id());
        }

        try {
            return objectMapper.readValue(answer.substring(start, end + 1), DRAFT_LIST);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Unreadable model answer for document " + document.id(), e);
        }
    }

    private static String insightTypeLabels() {
        return Arrays.stream(InsightType.values())
            .map(type -> type.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));
    }
}
