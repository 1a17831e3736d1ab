package com.taskforge.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.concurrent.CapacityExceededException;
import com.taskforge.core.engine.AgentRunner;
import com.taskforge.core.spawn.SessionSpawner;
import com.taskforge.core.spawn.SessionSummary;
import com.taskforge.core.spawn.SpawnConfig;
import com.taskforge.core.spawn.SpawnedSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private SessionSpawner spawner;

    @MockitoBean
    private AgentRunner agentRunner;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private SpawnedSession session(String runId, String name, String status) throws Exception {
        return objectMapper.readValue("""
                {"runId":"%s","name":"%s","instruction":"Write the report","status":"%s",
                 "progress":50,"currentStep":"Starting","maxIterations":15,"timeoutMs":300000,
                 "createdAt":"2026-03-02T10:00:00Z"}
                """.formatted(runId, name, status), SpawnedSession.class);
    }

    @Test
    @DisplayName("POST /sessions returns 202 with run_id and passes limits through")
    void spawn() throws Exception {
        when(spawner.spawn(any(SpawnConfig.class), any())).thenReturn(session("spawn_1", "report", "running"));

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"report","instruction":"Write the report","timeout_ms":60000,"max_iterations":5}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.run_id").value("spawn_1"))
                .andExpect(jsonPath("$.status").value("running"));

        verify(spawner).spawn(eq(new SpawnConfig("report", "Write the report", 60000L, 5)), same(agentRunner));
    }

    @Test
    @DisplayName("POST /sessions without a name uses 'session'")
    void defaultName() throws Exception {
        when(spawner.spawn(any(SpawnConfig.class), any())).thenReturn(session("spawn_2", "session", "running"));

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruction\":\"Do it\"}"))
                .andExpect(status().isAccepted());

        verify(spawner).spawn(eq(new SpawnConfig("session", "Do it", null, null)), same(agentRunner));
    }

    @Test
    @DisplayName("POST /sessions without instruction returns 400")
    void spawnBlank() throws Exception {
        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("instruction is required"));
    }

    @Test
    @DisplayName("POST /sessions at capacity returns 429 naming the active sessions")
    void spawnAtCapacity() throws Exception {
        when(spawner.spawn(any(SpawnConfig.class), any())).thenThrow(new CapacityExceededException(
                "Max concurrent sessions reached (3). Active: alpha, beta, gamma", 3));

        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruction\":\"Do it\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Max concurrent sessions reached (3). Active: alpha, beta, gamma"));
    }

    @Test
    @DisplayName("GET /sessions/{id} returns the session or 404")
    void getSession() throws Exception {
        when(spawner.getSession("spawn_1")).thenReturn(Optional.of(session("spawn_1", "report", "completed")));
        when(spawner.getSession("spawn_x")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/sessions/spawn_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("spawn_1"))
                .andExpect(jsonPath("$.status").value("completed"));
        mockMvc.perform(get("/api/v1/sessions/spawn_x"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /sessions/summary returns counts and text")
    void summary() throws Exception {
        when(spawner.getSummary()).thenReturn(new SessionSummary(1, Map.of("running", 1), List.of("report"),
                "Sub-agent sessions (1):\n  [50%] report (1.0s) - Starting"));

        mockMvc.perform(get("/api/v1/sessions/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.byStatus.running").value(1))
                .andExpect(jsonPath("$.activeNames", contains("report")))
                .andExpect(jsonPath("$.text", startsWith("Sub-agent sessions (1):")));
    }

    @Test
    @DisplayName("POST /sessions/{id}/cancel returns 200, 409 or 404")
    void cancel() throws Exception {
        when(spawner.cancel("spawn_1")).thenReturn(true);
        when(spawner.cancel("spawn_2")).thenReturn(false);
        when(spawner.getSession("spawn_2")).thenReturn(Optional.of(session("spawn_2", "old", "failed")));
        when(spawner.getSession("spawn_x")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/sessions/spawn_1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancelled"));
        mockMvc.perform(post("/api/v1/sessions/spawn_2/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Session spawn_2 is failed"));
        mockMvc.perform(post("/api/v1/sessions/spawn_x/cancel"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /sessions/{id}/events returns 404 for unknown session")
    void sseNotFound() throws Exception {
        when(spawner.getSession("spawn_x")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/sessions/spawn_x/events"))
                .andExpect(status().isNotFound());
        verifyNoInteractions(sseStreamingService);
    }
}
