package com.alleato.insights.repository;

import com.alleato.insights.model.Insight;
import com.alleato.insights.model.InsightSeverity;
import com.alleato.insights.model.InsightType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcInsightRepository implements InsightRepository {

    private final JdbcClient jdbcClient;
    private final JsonbConverter jsonb;

    private RowMapper<Insight> insightMapper() {
        return (rs, rowNum) -> {
            Date dueDate = rs.getDate("due_date");
            return new Insight(
                rs.getObject("id", UUID.class),
                rs.getObject("document_id", UUID.class),
                rs.getObject("project_id", UUID.class),
                InsightType.valueOf(rs.getString("insight_type")),
                rs.getString("title"),
                rs.getString("description"),
                InsightSeverity.valueOf(rs.getString("severity")),
                rs.getDouble("confidence_score"),
                rs.getString("assignee"),
                dueDate != null ? dueDate.toLocalDate() : null,
                rs.getBigDecimal("financial_impact"),
                rs.getString("business_impact"),
                JsonbConverter.toList(rs.getArray("exact_quotes")),
                JsonbConverter.toList(rs.getArray("stakeholders_affected")),
                rs.getBoolean("resolved"),
                rs.getDate("document_date").toLocalDate(),
                jsonb.fromJson(rs.getString("metadata")),
                rs.getObject("created_at", OffsetDateTime.class)
            );
        };
    }

    @Override
    @Transactional
    public List<Insight> saveAll(List<Insight> insights) {
        String sql = """
            INSERT INTO document_insights (document_id, project_id, insight_type, title, description,
                                           severity, confidence_score, assignee, due_date,
                                           financial_impact, business_impact, exact_quotes,
                                           stakeholders_affected, resolved, document_date, metadata)
            VALUES (:documentId, :projectId, :type, :title, :description,
                    :severity, :confidence, :assignee, :dueDate,
                    :financialImpact, :businessImpact, :exactQuotes,
                    :stakeholders, :resolved, :documentDate, CAST(:metadata AS jsonb))
            RETURNING *
            """;

        return insights.stream()
            .map(insight -> jdbcClient.sql(sql)
                .param("documentId", insight.documentId())
                .param("projectId", insight.projectId())
                .param("type", insight.type().name())
                .param("title", insight.title())
                .param("description", insight.description())
                .param("severity", insight.severity().name())
                .param("confidence", insight.confidenceScore())
                .param("assignee", insight.assignee())
                .param("dueDate", insight.dueDate())
                .param("financialImpact", insight.financialImpact())
                .param("businessImpact", insight.businessImpact())
                .param("exactQuotes", JsonbConverter.toArray(insight.exactQuotes()))
                .param("stakeholders", JsonbConverter.toArray(insight.stakeholdersAffected()))
                .param("resolved", insight.resolved())
                .param("documentDate", insight.documentDate())
                .param("metadata", jsonb.toJson(insight.metadata()))
                .query(insightMapper())
                .single())
            .toList();
    }

    @Override
    public boolean existsByDocumentId(UUID documentId) {
        return jdbcClient.sql("SELECT EXISTS (SELECT 1 FROM document_insights WHERE document_id = :docId)")
            .param("docId", documentId)
            .query(Boolean.class)
            .single();
    }

    @Override
    public List<Insight> findByDocumentId(UUID documentId) {
        String sql = """
            SELECT * FROM document_insights
            WHERE document_id = :docId
            ORDER BY document_date DESC, created_at ASC
            """;

        return jdbcClient.sql(sql)
            .param("docId", documentId)
            .query(insightMapper())
            .list();
    }

    @Override
    public int deleteByDocumentId(UUID documentId) {
        return jdbcClient.sql("DELETE FROM document_insights WHERE document_id = :docId")
            .param("docId", documentId)
            .update();
    }

    @Override
    public Optional<Insight> markResolved(UUID insightId, boolean resolved) {
        return jdbcClient.sql("UPDATE document_insights SET resolved = :resolved WHERE id = :id RETURNING *")
            .param("id", insightId)
            .param("resolved", resolved)
            .query(insightMapper())
            .optional();
    }
}
