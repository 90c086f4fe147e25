package com.alleato.insights.chunking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptChunkerTest {

    private final TranscriptChunker chunker = new TranscriptChunker(100, 200, 20);

    @Nested
    @DisplayName("Speaker turns")
    class Turns {

        @Test
        @DisplayName("Consecutive turns should be packed up to the target size")
        void shouldPackTurns() {
            String transcript = """
                [00:00:05] Alice: We need the steel order confirmed today.
                [00:00:30] Bob: I will call the supplier after lunch.
                [00:01:10] Alice: Also the crane booking for Friday.
                [00:01:45] Carol: Crane is confirmed.
                """;

            List<ChunkDraft> chunks = chunker.chunk(transcript);

            assertThat(chunks).hasSize(2);
            assertThat(chunks.get(0).content())
                .isEqualTo("Alice: We need the steel order confirmed today.\nBob: I will call the supplier after lunch.");
            assertThat(chunks.get(0).speaker()).isEqualTo("Alice, Bob");
            assertThat(chunks.get(1).speaker()).isEqualTo("Alice, Carol");
        }

        @Test
        @DisplayName("A chunk should end where the next one starts")
        void shouldCloseTimeRanges() {
            String transcript = """
                [00:00:05] Alice: We need the steel order confirmed today.
                [00:00:30] Bob: I will call the supplier after lunch.
                [00:01:10] Alice: Also the crane booking for Friday.
                [00:01:45] Carol: Crane is confirmed.
                """;

            List<ChunkDraft> chunks = chunker.chunk(transcript);

            assertThat(chunks.get(0).startTime()).isEqualTo(5.0);
            assertThat(chunks.get(0).endTime()).isEqualTo(70.0);
            assertThat(chunks.get(1).startTime()).isEqualTo(70.0);
            assertThat(chunks.get(1).endTime()).isEqualTo(105.0);
        }

        @Test
        @DisplayName("An oversized turn should be split but keep its speaker")
        void shouldSplitLongTurn() {
            String monologue = "The foundation pour moved to Tuesday because the inspector is out. ".repeat(8).strip();
            String transcript = "Alice: Quick update.\nBob: " + monologue + "\nAlice: Thanks.";

            List<ChunkDraft> chunks = chunker.chunk(transcript);

            List<ChunkDraft> bobPieces = chunks.stream().filter(c -> "Bob".equals(c.speaker())).toList();
            assertThat(bobPieces).hasSizeGreaterThan(1);
            assertThat(bobPieces).allSatisfy(c -> assertThat(c.content()).hasSizeLessThanOrEqualTo(200));
            assertThat(chunks.get(0).content()).isEqualTo("Alice: Quick update.");
            assertThat(chunks.get(chunks.size() - 1).content()).isEqualTo("Alice: Thanks.");
        }

        @Test
        @DisplayName("Lines without a speaker should stay with the previous turn")
        void shouldKeepContinuationLines() {
            String transcript = """
                Site walk notes
                Alice: The east wall is done
                and the scaffolding comes down Monday.
                **Bob**: Good, I'll tell the client.
                """;

            List<ChunkDraft> chunks = new TranscriptChunker(500, 800, 50).chunk(transcript);

            assertThat(chunks).hasSize(1);
            assertThat(chunks.get(0).content()).isEqualTo("""
                Site walk notes
                Alice: The east wall is done
                and the scaffolding comes down Monday.
                Bob: Good, I'll tell the client.""");
            assertThat(chunks.get(0).speaker()).isEqualTo("Alice, Bob");
            assertThat(chunks.get(0).startTime()).isNull();
            assertThat(chunks.get(0).endTime()).isNull();
        }

        @Test
        @DisplayName("Parenthesised timestamps after the name should be read")
        void shouldReadTrailingTimestamps() {
            String transcript = "Alice (1:05): Hello.\nBob (01:02:03): Hi.";

            List<ChunkDraft> chunks = chunker.chunk(transcript);

            assertThat(chunks).hasSize(1);
            assertThat(chunks.get(0).startTime()).isEqualTo(65.0);
            assertThat(chunks.get(0).endTime()).isEqualTo(3723.0);
        }
    }

    @Nested
    @DisplayName("Prose")
    class Prose {

        @Test
        @DisplayName("Text without speaker turns should be split by size")
        void shouldSplitProse() {
            String prose = "The contract covers foundation work and steel framing for the north wing. ".repeat(10);

            List<ChunkDraft> chunks = chunker.chunk(prose);

            assertThat(chunks).hasSizeGreaterThan(1);
            assertThat(chunks).allSatisfy(c -> {
                assertThat(c.content()).hasSizeLessThanOrEqualTo(100);
                assertThat(c.speaker()).isNull();
                assertThat(c.startTime()).isNull();
            });
        }

        @Test
        @DisplayName("A single turn is not enough to treat text as a transcript")
        void shouldTreatSingleTurnAsProse() {
            List<ChunkDraft> chunks = chunker.chunk("Alice: just one line");

            assertThat(chunks).hasSize(1);
            assertThat(chunks.get(0).speaker()).isNull();
        }

        @Test
        @DisplayName("Blank content should give no chunks")
        void shouldHandleBlankContent() {
            assertThat(chunker.chunk(null)).isEmpty();
            assertThat(chunker.chunk("  \n ")).isEmpty();
        }
    }

    @Test
    @DisplayName("Inconsistent sizes should be rejected")
    void shouldRejectInvalidSizes() {
        assertThatThrownBy(() -> new TranscriptChunker(100, 50, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TranscriptChunker(100, 200, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TranscriptChunker(0, 200, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Timestamps should convert to seconds")
    void shouldParseSeconds() {
        assertThat(TranscriptChunker.parseSeconds("1:05")).isEqualTo(65.0);
        assertThat(TranscriptChunker.parseSeconds("01:02:03")).isEqualTo(3723.0);
        assertThat(TranscriptChunker.parseSeconds(null)).isNull();
    }
}
