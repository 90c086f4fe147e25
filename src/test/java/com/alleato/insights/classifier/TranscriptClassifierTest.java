package com.alleato.insights.classifier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TranscriptClassifierTest {

    private final TranscriptClassifier classifier = new TranscriptClassifier(2000);

    @Nested
    @DisplayName("Title indicators")
    class Titles {

        @ParameterizedTest
        @ValueSource(strings = {
            "Weekly Sync", "Q4 Planning MEETING", "Client Call 23 September 2024", "Design Review",
            "Morning standup", "Project kickoff", "Safety briefing"
        })
        @DisplayName("Meeting-like titles should classify regardless of content")
        void shouldAcceptMeetingTitles(String title) {
            assertThat(classifier.classify(title, "no speakers here")).isTrue();
        }

        @Test
        @DisplayName("Plain titles with prose content should be rejected")
        void shouldRejectProse() {
            String prose = """
                The contract was signed last week.
                It covers foundation work and steel.
                Payment terms are net 30.
                """;

            assertThat(classifier.classify("Contract Summary", prose)).isFalse();
        }

        @Test
        @DisplayName("A missing title should fall back to content")
        void shouldHandleMissingTitle() {
            assertThat(classifier.classify(null, "Alice: hi\nBob: hello\n")).isTrue();
            assertThat(classifier.classify("  ", "nothing to see")).isFalse();
        }
    }

    @Nested
    @DisplayName("Speaker ratio")
    class SpeakerRatio {

        private final SpeakerRatioPolicy policy = new SpeakerRatioPolicy(2000);

        @Test
        @DisplayName("Named speakers should count")
        void shouldCountNamedSpeakers() {
            String content = """
                John Smith: Let's start.
                Anna Lee: Sure.

                Some note without a speaker.
                Another note.
                """;

            assertThat(policy.speakerRatio(content)).isCloseTo(0.5, within(1e-9));
            assertThat(classifier.classify("Notes", content)).isTrue();
        }

        @Test
        @DisplayName("Bracketed labels and timestamps should count")
        void shouldCountBracketedLabels() {
            String content = """
                [SPEAKER_1]: hello
                SPEAKER_2: hi
                [00:01:12] Anna opened the floor
                just text
                """;

            assertThat(policy.speakerRatio(content)).isCloseTo(0.75, within(1e-9));
        }

        @Test
        @DisplayName("A ratio at or below the minimum should not classify")
        void shouldRequireRatioAboveMinimum() {
            List<String> lines = new ArrayList<>();
            lines.add("Alice: one line");
            for (int i = 0; i < 9; i++) {
                lines.add("plain line " + i);
            }
            String tenPercent = String.join("\n", lines);

            assertThat(policy.speakerRatio(tenPercent)).isLessThanOrEqualTo(SpeakerRatioPolicy.MIN_RATIO);
            assertThat(classifier.classify("Notes", tenPercent)).isFalse();
        }

        @Test
        @DisplayName("Only the sample prefix should be inspected")
        void shouldOnlyInspectSample() {
            SpeakerRatioPolicy shortSample = new SpeakerRatioPolicy(20);
            String content = "plain text line here\nAlice: hi\nBob: hello\nCarol: hey";

            assertThat(shortSample.speakerRatio(content)).isZero();
        }

        @Test
        @DisplayName("Empty content should have a zero ratio")
        void shouldHandleEmptyContent() {
            assertThat(policy.speakerRatio(null)).isZero();
            assertThat(policy.speakerRatio("")).isZero();
            assertThat(policy.speakerRatio("\n\n  \n")).isZero();
        }
    }

    @Test
    @DisplayName("Policies should be consulted in order and stop at the first yes")
    void shouldStopAtFirstMatchingPolicy() {
        List<String> consulted = new ArrayList<>();
        ClassificationPolicy no = (title, content) -> {
            consulted.add("no");
            return false;
        };
        ClassificationPolicy yes = (title, content) -> consulted.add("yes");
        ClassificationPolicy never = (title, content) -> consulted.add("never");

        boolean result = new TranscriptClassifier(List.of(no, yes, never)).classify("x", "y");

        assertThat(result).isTrue();
        assertThat(consulted).containsExactly("no", "yes");
    }
}
