package com.alleato.insights.repository;

import com.alleato.insights.model.ClaimedItem;
import com.alleato.insights.model.ProcessingQueueItem;
import com.alleato.insights.model.QueueMonitorEntry;
import com.alleato.insights.model.QueueStats;
import com.alleato.insights.model.QueueStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcProcessingQueueRepository implements ProcessingQueueRepository {

    private final JdbcClient jdbcClient;
    private final JsonbConverter jsonb;

    private RowMapper<ProcessingQueueItem> queueItemMapper() {
        return (rs, rowNum) -> new ProcessingQueueItem(
            rs.getLong("id"),
            rs.getObject("document_id", UUID.class),
            rs.getString("document_title"),
            QueueStatus.valueOf(rs.getString("status")),
            rs.getInt("retry_count"),
            rs.getString("error_message"),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("started_at", OffsetDateTime.class),
            rs.getObject("completed_at", OffsetDateTime.class),
            jsonb.fromJson(rs.getString("metadata"))
        );
    }

    @Override
    public boolean enqueue(UUID documentId, String title, Map<String, Object> metadata, boolean requireNoInsights) {
        String sql = """
            INSERT INTO insights_processing_queue (document_id, document_title, metadata)
            SELECT :documentId, :title, CAST(:metadata AS jsonb)
            WHERE NOT :requireNoInsights
               OR NOT EXISTS (SELECT 1 FROM document_insights di WHERE di.document_id = :documentId)
            ON CONFLICT (document_id) WHERE status IN ('PENDING', 'PROCESSING') DO NOTHING
            """;

        int inserted = jdbcClient.sql(sql)
            .param("documentId", documentId)
            .param("title", title)
            .param("metadata", jsonb.toJson(metadata))
            .param("requireNoInsights", requireNoInsights)
            .update();

        return inserted > 0;
    }

    @Override
    @Transactional
    public Optional<ClaimedItem> claimNext(int maxRetries) {
        String sql = """
            UPDATE insights_processing_queue q
            SET status = 'PROCESSING',
                started_at = NOW(),
                retry_count = q.retry_count + 1
            FROM (
                SELECT id FROM insights_processing_queue
                WHERE status = 'PENDING'
                  AND retry_count < :maxRetries
                ORDER BY created_at ASC, id ASC
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            ) next
            WHERE q.id = next.id
            RETURNING q.id, q.document_id, q.document_title, q.created_at, q.retry_count, q.metadata
            """;

        return jdbcClient.sql(sql)
            .param("maxRetries", maxRetries)
            .query((rs, rowNum) -> new ClaimedItem(
                rs.getLong("id"),
                rs.getObject("document_id", UUID.class),
                rs.getString("document_title"),
                rs.getObject("created_at", OffsetDateTime.class),
                rs.getInt("retry_count"),
                Boolean.TRUE.equals(jsonb.fromJson(rs.getString("metadata")).get(ProcessingQueueItem.FORCE_REPROCESS))
            ))
            .optional();
    }

    @Override
    public Optional<QueueStatus> markCompleted(long queueId, int insightCount) {
        String sql = """
            UPDATE insights_processing_queue
            SET status = 'COMPLETED',
                completed_at = NOW(),
                error_message = NULL,
                metadata = metadata || jsonb_build_object(
                    'completed_at', NOW(),
                    'insights_generated', CAST(:insightCount AS integer)
                )
            WHERE id = :id
              AND status = 'PROCESSING'
            RETURNING status
            """;

        return jdbcClient.sql(sql)
            .param("id", queueId)
            .param("insightCount", insightCount)
            .query((rs, rowNum) -> QueueStatus.valueOf(rs.getString("status")))
            .optional();
    }

    @Override
    public Optional<QueueStatus> markAttemptFailed(long queueId, String errorMessage, int maxRetries) {
        String sql = """
            UPDATE insights_processing_queue
            SET status = CASE WHEN retry_count >= :maxRetries THEN 'FAILED' ELSE 'PENDING' END,
                error_message = :error,
                metadata = metadata || jsonb_build_object(
                    'last_error_at', NOW(),
                    'error_message', CAST(:error AS text)
                )
            WHERE id = :id
              AND status = 'PROCESSING'
            RETURNING status
            """;

        return jdbcClient.sql(sql)
            .param("id", queueId)
            .param("error", errorMessage)
            .param("maxRetries", maxRetries)
            .query((rs, rowNum) -> QueueStatus.valueOf(rs.getString("status")))
            .optional();
    }

    @Override
    @Transactional
    public List<UUID> reclaimStale(int staleThresholdMinutes, int maxRetries) {
        String sql = """
            UPDATE insights_processing_queue
            SET status = CASE WHEN retry_count >= :maxRetries THEN 'FAILED' ELSE 'PENDING' END,
                error_message = CASE WHEN retry_count >= :maxRetries
                                     THEN 'Processing timed out' ELSE error_message END,
                started_at = NULL,
                metadata = metadata || jsonb_build_object('reclaimed_at', NOW())
            WHERE id IN (
                SELECT id FROM insights_processing_queue
                WHERE status = 'PROCESSING'
                  AND started_at < NOW() - (INTERVAL '1 minute' * :staleMins)
                FOR UPDATE SKIP LOCKED
            )
            RETURNING document_id, status
            """;

        return jdbcClient.sql(sql)
            .param("staleMins", staleThresholdMinutes)
            .param("maxRetries", maxRetries)
            .query((rs, rowNum) -> QueueStatus.PENDING.name().equals(rs.getString("status"))
                ? rs.getObject("document_id", UUID.class)
                : null)
            .list()
            .stream()
            .filter(Objects::nonNull)
            .toList();
    }

    @Override
    public Optional<ProcessingQueueItem> findById(long queueId) {
        return jdbcClient.sql("SELECT * FROM insights_processing_queue WHERE id = :id")
            .param("id", queueId)
            .query(queueItemMapper())
            .optional();
    }

    @Override
    public QueueStats stats() {
        String sql = """
            SELECT
                COUNT(*) FILTER (WHERE status = 'PENDING') AS pending,
                COUNT(*) FILTER (WHERE status = 'PROCESSING') AS processing,
                COUNT(*) FILTER (WHERE status = 'COMPLETED') AS completed,
                COUNT(*) FILTER (WHERE status = 'FAILED') AS failed,
                COUNT(*) AS total,
                EXTRACT(EPOCH FROM (NOW() - MIN(created_at) FILTER (WHERE status = 'PENDING')))
                    AS oldest_pending_seconds
            FROM insights_processing_queue
            """;

        return jdbcClient.sql(sql)
            .query((rs, rowNum) -> new QueueStats(
                rs.getLong("pending"),
                rs.getLong("processing"),
                rs.getLong("completed"),
                rs.getLong("failed"),
                rs.getLong("total"),
                toDuration(rs.getObject("oldest_pending_seconds", Double.class))
            ))
            .single();
    }

    @Override
    @Transactional
    public int resetFailed() {
        // One row per document, and never next to a live row: the partial unique index
        // allows a single PENDING/PROCESSING entry per document.
        String sql = """
            UPDATE insights_processing_queue
            SET status = 'PENDING',
                retry_count = 0,
                error_message = NULL,
                started_at = NULL,
                metadata = metadata || jsonb_build_object('reset_at', NOW())
            WHERE id IN (
                SELECT DISTINCT ON (f.document_id) f.id
                FROM insights_processing_queue f
                WHERE f.status = 'FAILED'
                  AND NOT EXISTS (
                      SELECT 1 FROM insights_processing_queue live
                      WHERE live.document_id = f.document_id
                        AND live.status IN ('PENDING', 'PROCESSING')
                  )
                ORDER BY f.document_id, f.created_at DESC
            )
            """;

        return jdbcClient.sql(sql).update();
    }

    @Override
    public int deleteCompletedOlderThan(int days) {
        String sql = """
            DELETE FROM insights_processing_queue
            WHERE status = 'COMPLETED'
              AND completed_at < NOW() - (INTERVAL '1 day' * :days)
            """;

        return jdbcClient.sql(sql)
            .param("days", days)
            .update();
    }

    @Override
    public List<QueueMonitorEntry> findRecent(int limit) {
        String sql = """
            SELECT q.*,
                   (SELECT COUNT(*) FROM document_insights di WHERE di.document_id = q.document_id)
                       AS existing_insights_count,
                   CASE
                       WHEN q.status = 'PENDING' THEN EXTRACT(EPOCH FROM (NOW() - q.created_at))
                       WHEN q.status = 'PROCESSING' THEN EXTRACT(EPOCH FROM (NOW() - q.started_at))
                   END AS processing_seconds
            FROM insights_processing_queue q
            ORDER BY q.created_at DESC
            LIMIT :limit
            """;

        return jdbcClient.sql(sql)
            .param("limit", limit)
            .query((rs, rowNum) -> {
                Double seconds = rs.getObject("processing_seconds", Double.class);
                return new QueueMonitorEntry(
                    queueItemMapper().mapRow(rs, rowNum),
                    seconds == null ? null : toDuration(seconds),
                    rs.getLong("existing_insights_count")
                );
            })
            .list();
    }

    private static Duration toDuration(Double seconds) {
        if (seconds == null || seconds < 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }
}
