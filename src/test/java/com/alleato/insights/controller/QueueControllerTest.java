package com.alleato.insights.controller;

import com.alleato.insights.config.QueueProperties;
import com.alleato.insights.exception.WrongQueryException;
import com.alleato.insights.model.ProcessingQueueItem;
import com.alleato.insights.model.QueueMonitorEntry;
import com.alleato.insights.model.QueueStats;
import com.alleato.insights.model.QueueStatus;
import com.alleato.insights.service.ProcessingQueueService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueueController.class)
class QueueControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProcessingQueueService queueService;

    @MockitoBean
    private QueueProperties queueProperties;

    @Test
    @DisplayName("GET /queue/stats should report counts and the oldest pending age")
    void stats_ShouldReturnCounts() throws Exception {
        when(queueService.stats()).thenReturn(new QueueStats(2, 1, 10, 3, 16, Duration.ofMinutes(5)));

        mockMvc.perform(get("/queue/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pending").value(2))
            .andExpect(jsonPath("$.failed").value(3))
            .andExpect(jsonPath("$.total").value(16))
            .andExpect(jsonPath("$.oldest_pending_seconds").value(300));
    }

    @Test
    @DisplayName("GET /queue/items should list recent items with their insight counts")
    void items_ShouldListRecentItems() throws Exception {
        UUID docId = UUID.randomUUID();
        ProcessingQueueItem item = new ProcessingQueueItem(42L, docId, "Weekly Sync", QueueStatus.FAILED, 3,
            "ExtractionException: model unavailable", OffsetDateTime.now(), null, null, Map.of());
        when(queueService.findRecent(10)).thenReturn(List.of(new QueueMonitorEntry(item, null, 0)));

        mockMvc.perform(get("/queue/items").param("limit", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(42))
            .andExpect(jsonPath("$[0].document_id").value(docId.toString()))
            .andExpect(jsonPath("$[0].status").value("FAILED"))
            .andExpect(jsonPath("$[0].retry_count").value(3))
            .andExpect(jsonPath("$[0].existing_insights_count").value(0));
    }

    @Test
    @DisplayName("GET /queue/items with an out-of-range limit should return 400")
    void items_ShouldReturn400_WhenLimitInvalid() throws Exception {
        when(queueService.findRecent(0)).thenThrow(new WrongQueryException("Limit must be between 1 and 500, got 0"));

        mockMvc.perform(get("/queue/items").param("limit", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("WRONG_QUERY"));
    }

    @Test
    @DisplayName("POST /queue/reset-failed should report how many items were revived")
    void resetFailed_ShouldReturnCount() throws Exception {
        when(queueService.resetFailed()).thenReturn(4);

        mockMvc.perform(post("/queue/reset-failed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.action").value("reset_failed"))
            .andExpect(jsonPath("$.count").value(4));
    }

    @Test
    @DisplayName("POST /queue/cleanup should default to the retention window")
    void cleanup_ShouldUseRetentionByDefault() throws Exception {
        when(queueProperties.retentionDays()).thenReturn(7);
        when(queueService.cleanupCompleted(7)).thenReturn(12);

        mockMvc.perform(post("/queue/cleanup"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(12));

        verify(queueService).cleanupCompleted(7);
    }

    @Test
    @DisplayName("POST /queue/cleanup should accept an explicit age")
    void cleanup_ShouldUseExplicitAge() throws Exception {
        when(queueService.cleanupCompleted(30)).thenReturn(1);

        mockMvc.perform(post("/queue/cleanup").param("older_than_days", "30"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.action").value("cleanup"))
            .andExpect(jsonPath("$.count").value(1));
    }

    @Test
    @DisplayName("POST /queue/backfill should report how many documents were queued")
    void backfill_ShouldReturnCount() throws Exception {
        when(queueService.backfillUnprocessed()).thenReturn(5);

        mockMvc.perform(post("/queue/backfill"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(5));
    }
}
