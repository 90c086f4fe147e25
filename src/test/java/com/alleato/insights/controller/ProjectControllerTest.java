package com.alleato.insights.controller;

import com.alleato.insights.service.ProjectResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProjectController.class)
class ProjectControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProjectResolver projectResolver;

    @Test
    @DisplayName("GET /projects/resolve should return the matching project id")
    void resolve_ShouldReturnProjectId() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(projectResolver.resolve("riverside tower")).thenReturn(Optional.of(projectId));

        mockMvc.perform(get("/projects/resolve").param("mention", "riverside tower"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mention").value("riverside tower"))
            .andExpect(jsonPath("$.project_id").value(projectId.toString()));
    }

    @Test
    @DisplayName("GET /projects/resolve with no match should return an empty id")
    void resolve_ShouldReturnNullWhenNoMatch() throws Exception {
        when(projectResolver.resolve("lunch")).thenReturn(Optional.empty());

        mockMvc.perform(get("/projects/resolve").param("mention", "lunch"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.project_id").doesNotExist());
    }

    @Test
    @DisplayName("GET /projects/resolve without a mention should return 400")
    void resolve_ShouldReturn400_WhenMentionMissing() throws Exception {
        mockMvc.perform(get("/projects/resolve"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("MISSING_PARAMETER"));
    }
}
