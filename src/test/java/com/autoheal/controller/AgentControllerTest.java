package com.autoheal.controller;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AgentControllerTest {

    @TempDir
    static Path workspace;

    @DynamicPropertySource
    static void workspaceProperties(DynamicPropertyRegistry registry) {
        registry.add("autoheal.workspace-path", () -> workspace.toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testStatus() throws Exception {
        mockMvc.perform(get("/agents/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not_available"))
                .andExpect(jsonPath("$.model_available").value(false))
                .andExpect(jsonPath("$.backend.kind").value("DISABLED"));
    }

    @Test
    void testAudit() throws Exception {
        mockMvc.perform(post("/agents/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.log_analysis.sources.error.error").value("Log file not found: log/error.log"));
    }

    @Test
    void testOptimizeWithoutBody() throws Exception {
        mockMvc.perform(post("/agents/optimize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.improvements").isArray());
    }

    @Test
    void testRepairWithSelectedKinds() throws Exception {
        mockMvc.perform(post("/agents/repair")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"types\":[\"logs\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success_count").value(0));
    }

    @Test
    void testUnknownKindIsBadRequest() throws Exception {
        mockMvc.perform(post("/agents/repair")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"types\":[\"bogus\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown repair kind: bogus (expected logs, code or dependencies)"));
    }

    @Test
    void testInsights() throws Exception {
        mockMvc.perform(get("/agents/insights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.common_errors").isArray());
    }
}
