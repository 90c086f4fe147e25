package com.alleato.insights.repository;

import com.alleato.insights.model.ChunkSearchResult;
import com.alleato.insights.model.DocumentChunk;
import com.alleato.insights.model.NewChunk;
import com.alleato.insights.model.ParentDocument;
import com.alleato.insights.model.SearchFilters;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentChunkRepository implements DocumentChunkRepository {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    @Value("${app.embedding.dimension:768}")
    private int embeddingDimension;

    private final RowMapper<DocumentChunk> chunkMapper = (rs, rowNum) -> new DocumentChunk(
        rs.getObject("id", UUID.class),
        rs.getObject("document_id", UUID.class),
        rs.getInt("chunk_index"),
        rs.getString("content"),
        rs.getString("speaker"),
        seconds(rs, "start_time"),
        seconds(rs, "end_time"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    @Transactional
    public int replaceChunks(UUID documentId, List<NewChunk> chunks) {
        for (int i = 0; i < chunks.size(); i++) {
            float[] embedding = chunks.get(i).embedding();
            if (embedding == null || embedding.length != embeddingDimension) {
                throw new IllegalArgumentException("Chunk %d of document %s has embedding dimension %s, expected %d"
                    .formatted(i, documentId, embedding == null ? "null" : embedding.length, embeddingDimension));
            }
        }

        jdbcClient.sql("DELETE FROM document_chunks WHERE document_id = :docId")
            .param("docId", documentId)
            .update();

        if (chunks.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO document_chunks (document_id, chunk_index, content, speaker, start_time, end_time, embedding)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                NewChunk chunk = chunks.get(i);
                ps.setObject(1, documentId);
                ps.setInt(2, i);
                ps.setString(3, chunk.content());
                ps.setString(4, chunk.speaker());
                setSeconds(ps, 5, chunk.startTime());
                setSeconds(ps, 6, chunk.endTime());
                ps.setObject(7, new PGvector(chunk.embedding()));
            }

            @Override
            public int getBatchSize() {
                return chunks.size();
            }
        });

        return chunks.size();
    }

    @Override
    public List<DocumentChunk> findByDocumentId(UUID documentId) {
        return jdbcClient.sql("SELECT * FROM document_chunks WHERE document_id = :docId ORDER BY chunk_index")
            .param("docId", documentId)
            .query(chunkMapper)
            .list();
    }

    @Override
    public List<ChunkSearchResult> findSimilar(float[] queryEmbedding, double threshold, int limit,
                                               SearchFilters filters) {
        SearchFilters f = filters != null ? filters : SearchFilters.none();

        StringBuilder where = new StringBuilder("1 - (c.embedding <=> :vector) > :threshold");
        if (f.source() != null) {
            where.append(" AND d.source = :source");
        }
        if (f.category() != null) {
            where.append(" AND d.category = :category");
        }
        if (f.projectId() != null) {
            where.append(" AND d.project_id = :projectId");
        }
        if (f.occurredFrom() != null) {
            where.append(" AND d.occurred_at >= :occurredFrom");
        }
        if (f.occurredTo() != null) {
            where.append(" AND d.occurred_at <= :occurredTo");
        }

        // 1 - cosine distance gives the similarity score
        String sql = """
            SELECT c.*,
                   1 - (c.embedding <=> :vector) AS similarity,
                   d.title AS doc_title,
                   d.source AS doc_source,
                   d.category AS doc_category,
                   d.occurred_at AS doc_occurred_at,
                   d.participants AS doc_participants,
                   d.project_id AS doc_project_id,
                   p.name AS project_name
            FROM document_chunks c
            JOIN documents d ON d.id = c.document_id
            LEFT JOIN projects p ON p.id = d.project_id
            WHERE %s
            ORDER BY similarity DESC, d.occurred_at DESC NULLS LAST, c.chunk_index ASC
            LIMIT :limit
            """.formatted(where);

        var statement = jdbcClient.sql(sql)
            .param("vector", new PGvector(queryEmbedding))
            .param("threshold", threshold)
            .param("limit", limit);

        if (f.source() != null) {
            statement = statement.param("source", f.source());
        }
        if (f.category() != null) {
            statement = statement.param("category", f.category());
        }
        if (f.projectId() != null) {
            statement = statement.param("projectId", f.projectId());
        }
        if (f.occurredFrom() != null) {
            statement = statement.param("occurredFrom", f.occurredFrom());
        }
        if (f.occurredTo() != null) {
            statement = statement.param("occurredTo", f.occurredTo());
        }

        return statement.query((rs, rowNum) -> new ChunkSearchResult(
            chunkMapper.mapRow(rs, rowNum),
            rs.getDouble("similarity"),
            new ParentDocument(
                rs.getObject("document_id", UUID.class),
                rs.getString("doc_title"),
                rs.getString("doc_source"),
                rs.getString("doc_category"),
                rs.getObject("doc_occurred_at", OffsetDateTime.class),
                JsonbConverter.toList(rs.getArray("doc_participants")),
                rs.getObject("doc_project_id", UUID.class),
                rs.getString("project_name")
            )
        )).list();
    }

    private static Double seconds(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value != null ? value.doubleValue() : null;
    }

    private static void setSeconds(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.NUMERIC);
        } else {
            ps.setBigDecimal(index, BigDecimal.valueOf(value));
        }
    }
}
