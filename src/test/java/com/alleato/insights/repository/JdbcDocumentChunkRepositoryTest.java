package com.alleato.insights.repository;

import com.alleato.insights.model.ChunkSearchResult;
import com.alleato.insights.model.Document;
import com.alleato.insights.model.DocumentChunk;
import com.alleato.insights.model.NewChunk;
import com.alleato.insights.model.Project;
import com.alleato.insights.model.ProjectStatus;
import com.alleato.insights.model.SearchFilters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.annotation.DirtiesContext;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class JdbcDocumentChunkRepositoryTest extends BaseIntegrationTest {

    private static final OffsetDateTime MONDAY = OffsetDateTime.of(2024, 9, 23, 10, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private DocumentChunkRepository chunkRepository;

    @Autowired
    private ProjectRepository projectRepository;

    private static NewChunk chunk(String content, int axis) {
        return new NewChunk(content, "Alice", 0.0, 12.5, vector(axis));
    }

    @Nested
    @DisplayName("Replace")
    class Replace {

        @Test
        @DisplayName("Indices should stay dense after repeated replaces")
        void shouldKeepIndicesDense() {
            Document doc = saveDocument("Weekly Sync", "content");

            chunkRepository.replaceChunks(doc.id(), List.of(chunk("a", 0), chunk("b", 1), chunk("c", 2), chunk("d", 3)));
            int stored = chunkRepository.replaceChunks(doc.id(), List.of(chunk("x", 4), chunk("y", 5)));

            List<DocumentChunk> chunks = chunkRepository.findByDocumentId(doc.id());
            assertThat(stored).isEqualTo(2);
            assertThat(chunks).extracting(DocumentChunk::chunkIndex).containsExactly(0, 1);
            assertThat(chunks).extracting(DocumentChunk::content).containsExactly("x", "y");
        }

        @Test
        @DisplayName("Should keep speaker and time range")
        void shouldStoreSpeakerAndTimes() {
            Document doc = saveDocument("Weekly Sync", "content");

            chunkRepository.replaceChunks(doc.id(), List.of(
                new NewChunk("Alice: hello", "Alice, Bob", 5.0, 65.5, vector(0)),
                new NewChunk("plain prose", null, null, null, vector(1))
            ));

            List<DocumentChunk> chunks = chunkRepository.findByDocumentId(doc.id());
            assertThat(chunks.get(0).speaker()).isEqualTo("Alice, Bob");
            assertThat(chunks.get(0).startTime()).isEqualTo(5.0);
            assertThat(chunks.get(0).endTime()).isEqualTo(65.5);
            assertThat(chunks.get(1).speaker()).isNull();
            assertThat(chunks.get(1).startTime()).isNull();
        }

        @Test
        @DisplayName("An empty list should remove every chunk")
        void shouldClearWithEmptyList() {
            Document doc = saveDocument("Weekly Sync", "content");
            chunkRepository.replaceChunks(doc.id(), List.of(chunk("a", 0)));

            assertThat(chunkRepository.replaceChunks(doc.id(), List.of())).isZero();
            assertThat(chunkRepository.findByDocumentId(doc.id())).isEmpty();
        }

        @Test
        @DisplayName("A wrong embedding dimension should be rejected without touching stored chunks")
        void shouldRejectWrongDimension() {
            Document doc = saveDocument("Weekly Sync", "content");
            chunkRepository.replaceChunks(doc.id(), List.of(chunk("kept", 0)));

            List<NewChunk> invalid = List.of(chunk("ok", 1), new NewChunk("bad", null, null, null, new float[DIMENSION - 1]));

            assertThatThrownBy(() -> chunkRepository.replaceChunks(doc.id(), invalid))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected " + DIMENSION);
            assertThat(chunkRepository.findByDocumentId(doc.id()))
                .extracting(DocumentChunk::content)
                .containsExactly("kept");
        }

        @Test
        @DisplayName("Chunks should go away with their document")
        void shouldCascadeOnDocumentDelete() {
            Document doc = saveDocument("Weekly Sync", "content");
            chunkRepository.replaceChunks(doc.id(), List.of(chunk("a", 0)));

            jdbcClient.sql("DELETE FROM documents WHERE id = ?").param(doc.id()).update();

            assertThat(chunkRepository.findByDocumentId(doc.id())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Similarity search")
    class Search {

        @Test
        @DisplayName("An identical vector should rank first with a similarity of one")
        void shouldRankIdenticalVectorFirst() {
            Document doc = saveDocument("Weekly Sync", "content", MONDAY, null);
            chunkRepository.replaceChunks(doc.id(), List.of(chunk("other", 1), chunk("match", 0), chunk("far", 2)));

            List<ChunkSearchResult> results = chunkRepository.findSimilar(vector(0), 0.0, 10, SearchFilters.none());

            assertThat(results).hasSize(3);
            assertThat(results.get(0).chunk().content()).isEqualTo("match");
            assertThat(results.get(0).similarity()).isCloseTo(1.0, within(1e-4));
            assertThat(results.get(0).document().title()).isEqualTo("Weekly Sync");
            assertThat(results.get(0).document().participants()).containsExactly("Alice", "Bob");
            assertThat(results).extracting(ChunkSearchResult::similarity).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        }

        @Test
        @DisplayName("Threshold should drop weak matches and limit should cap the result")
        void shouldApplyThresholdAndLimit() {
            Document doc = saveDocument("Weekly Sync", "content");
            chunkRepository.replaceChunks(doc.id(), List.of(chunk("match", 0), chunk("other", 1), chunk("far", 2)));

            assertThat(chunkRepository.findSimilar(vector(0), 0.5, 10, SearchFilters.none()))
                .extracting(r -> r.chunk().content())
                .containsExactly("match");
            assertThat(chunkRepository.findSimilar(vector(0), 0.0, 2, SearchFilters.none())).hasSize(2);
        }

        @Test
        @DisplayName("Equal scores should prefer the most recent meeting")
        void shouldBreakTiesByOccurredAt() {
            Document older = saveDocument("Older Sync", "content", MONDAY.minusWeeks(1), null);
            Document newer = saveDocument("Newer Sync", "content", MONDAY, null);
            Document undated = saveDocument("Undated Sync", "content", null, null);
            chunkRepository.replaceChunks(older.id(), List.of(chunk("older", 0)));
            chunkRepository.replaceChunks(undated.id(), List.of(chunk("undated", 0)));
            chunkRepository.replaceChunks(newer.id(), List.of(chunk("newer", 0)));

            List<ChunkSearchResult> results = chunkRepository.findSimilar(vector(0), 0.5, 10, SearchFilters.none());

            assertThat(results).extracting(r -> r.chunk().content()).containsExactly("newer", "older", "undated");
        }

        @Test
        @DisplayName("Filters should restrict on the parent document")
        void shouldFilterOnParentDocument() {
            Project project = projectRepository.save(new Project(null, "Riverside Tower", List.of("RT"), List.of(), ProjectStatus.ACTIVE, null, null));
            Document inProject = saveDocument("Tower Sync", "content", MONDAY, project.id());
            Document elsewhere = saveDocument("Other Sync", "content", MONDAY.minusMonths(2), null);
            chunkRepository.replaceChunks(inProject.id(), List.of(chunk("tower", 0)));
            chunkRepository.replaceChunks(elsewhere.id(), List.of(chunk("other", 0)));

            List<ChunkSearchResult> byProject = chunkRepository.findSimilar(vector(0), 0.5, 10,
                new SearchFilters(null, null, project.id(), null, null));
            assertThat(byProject).extracting(r -> r.chunk().content()).containsExactly("tower");
            assertThat(byProject.get(0).document().projectName()).isEqualTo("Riverside Tower");

            List<ChunkSearchResult> byDate = chunkRepository.findSimilar(vector(0), 0.5, 10,
                new SearchFilters(null, null, null, MONDAY.minusMonths(3), MONDAY.minusMonths(1)));
            assertThat(byDate).extracting(r -> r.chunk().content()).containsExactly("other");

            assertThat(chunkRepository.findSimilar(vector(0), 0.5, 10,
                new SearchFilters("zoom", null, null, null, null))).isEmpty();
            assertThat(chunkRepository.findSimilar(vector(0), 0.5, 10,
                new SearchFilters("fireflies", Document.CATEGORY_MEETING, null, null, null))).hasSize(2);
        }

        @Test
        @DisplayName("Search on an empty store should return nothing")
        void shouldReturnEmptyWithoutChunks() {
            assertThat(chunkRepository.findSimilar(vector(0), 0.0, 10, SearchFilters.none())).isEmpty();
        }

        @Test
        @DisplayName("Results should point at the right document")
        void shouldReturnParentIds() {
            Document doc = saveDocument("Weekly Sync", "content");
            chunkRepository.replaceChunks(doc.id(), List.of(chunk("match", 0)));

            ChunkSearchResult result = chunkRepository.findSimilar(vector(0), 0.5, 1, null).get(0);

            assertThat(result.document().id()).isEqualTo(doc.id());
            assertThat(result.chunk().documentId()).isEqualTo(doc.id());
            assertThat(result.chunk().id()).isInstanceOf(UUID.class);
        }
    }
}
