package com.alleato.insights.repository;

import com.alleato.insights.model.Document;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private final JdbcClient jdbcClient;
    private final JsonbConverter jsonb;

    private RowMapper<Document> documentRowMapper() {
        return (rs, rowNum) -> new Document(
            rs.getObject("id", UUID.class),
            rs.getString("title"),
            rs.getString("content"),
            rs.getString("source"),
            rs.getString("category"),
            rs.getObject("occurred_at", OffsetDateTime.class),
            rs.getObject("project_id", UUID.class),
            JsonbConverter.toList(rs.getArray("participants")),
            rs.getString("summary"),
            jsonb.fromJson(rs.getString("metadata")),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class)
        );
    }

    @Override
    public Document save(Document document) {
        return jdbcClient.sql("""
                INSERT INTO documents (title, content, source, category, occurred_at, project_id,
                                       participants, summary, metadata)
                VALUES (:title, :content, :source, :category, :occurredAt, :projectId,
                        :participants, :summary, CAST(:metadata AS jsonb))
                RETURNING *
                """)
            .param("title", document.title())
            .param("content", document.content())
            .param("source", document.source() != null ? document.source() : "upload")
            .param("category", document.category() != null ? document.category() : Document.CATEGORY_OTHER)
            .param("occurredAt", document.occurredAt())
            .param("projectId", document.projectId())
            .param("participants", JsonbConverter.toArray(document.participants()))
            .param("summary", document.summary())
            .param("metadata", jsonb.toJson(document.metadata()))
            .query(documentRowMapper())
            .single();
    }

    @Override
    public Optional<Document> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper())
            .optional();
    }

    @Override
    public List<Document> findUnprocessed(int sampleChars) {
        String sql = """
            SELECT d.id, d.title, LEFT(d.content, :sampleChars) AS content, d.source, d.category,
                   d.occurred_at, d.project_id, d.participants, d.summary, d.metadata,
                   d.created_at, d.updated_at
            FROM documents d
            WHERE NOT EXISTS (
                SELECT 1 FROM document_insights di WHERE di.document_id = d.id
            )
            AND NOT EXISTS (
                SELECT 1 FROM insights_processing_queue q
                WHERE q.document_id = d.id
                  AND q.status IN ('PENDING', 'PROCESSING', 'COMPLETED')
            )
            ORDER BY d.created_at ASC
            """;

        return jdbcClient.sql(sql)
            .param("sampleChars", sampleChars)
            .query(documentRowMapper())
            .list();
    }
}
