package dev.repodocs.controller;

import dev.repodocs.dto.response.ProjectResponse;
import dev.repodocs.service.ProjectQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.boot.webmvc.test.autoconfigure.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import tools.jackson.databind.json.JsonMapper;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProjectController.class)
@AutoConfigureMockMvc(addFilters = false)
class ProjectControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProjectQueryService queryService;

    @Test
    @DisplayName("returns the stored docs for a known slug")
    void found() throws Exception {
        when(queryService.findBySlug("widgets-owner-42")).thenReturn(Optional.of(new ProjectResponse(
                "widgets-owner-42", "widgets", "https://github.com/acme/widgets", "readme",
                JsonMapper.builder().build().readTree("{\"title\":\"Widgets\"}"), Instant.parse("2026-01-01T00:00:00Z"))));

        mockMvc.perform(get("/api/projects/widgets-owner-42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug").value("widgets-owner-42"))
                .andExpect(jsonPath("$.docs.title").value("Widgets"));
    }

    @Test
    @DisplayName("returns 404 for an unknown slug")
    void notFound() throws Exception {
        when(queryService.findBySlug("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/projects/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Not Found"));
    }
}
