package com.alleato.insights.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentDateExtractorTest {

    private static final LocalDate SEPT_23 = LocalDate.of(2024, 9, 23);

    private final DocumentDateExtractor extractor = new DocumentDateExtractor();

    @ParameterizedTest
    @ValueSource(strings = {
        "Team Standup - 2024-09-23",
        "Q4 Planning Meeting 09/23/2024",
        "Q4 Planning Meeting 9-23-2024",
        "Project Review - September 23, 2024",
        "Project Review - Sep 23, 2024",
        "Client Call 23 September 2024",
        "Weekly Sync 2024_09_23",
        "Weekly Sync 2024.09.23"
    })
    @DisplayName("Should recognise every supported format")
    void shouldParseSupportedFormats(String title) {
        assertThat(extractor.extract(title)).contains(SEPT_23);
    }

    @Test
    @DisplayName("Earlier formats should win over later ones")
    void shouldRespectPriority() {
        assertThat(extractor.extract("Sync 2024_01_05 notes from 2024-09-23")).contains(SEPT_23);
    }

    @Test
    @DisplayName("Impossible dates should be skipped in favour of the next match")
    void shouldSkipInvalidDates() {
        assertThat(extractor.extract("Draft 2024-02-30, final 2024-09-23")).contains(SEPT_23);
        assertThat(extractor.extract("Meeting 13/45/2024")).isEmpty();
    }

    @Test
    @DisplayName("Text without a date should give nothing")
    void shouldReturnEmptyWithoutDate() {
        assertThat(extractor.extract("Weekly Sync")).isEmpty();
        assertThat(extractor.extract("")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
