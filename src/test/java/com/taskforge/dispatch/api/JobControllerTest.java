package com.taskforge.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.concurrent.CapacityExceededException;
import com.taskforge.core.scheduler.CronScheduler;
import com.taskforge.core.scheduler.InvalidCronExpressionException;
import com.taskforge.core.scheduler.ScheduledJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(JobController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class JobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private CronScheduler scheduler;

    private ScheduledJob job(String id, String name, String cron) throws Exception {
        return objectMapper.readValue("""
                {"id":"%s","name":"%s","cronExpression":"%s","instruction":"Send the digest",
                 "enabled":true,"createdAt":"2026-03-02T09:00:00Z","nextRunAt":"2026-03-03T09:00:00Z"}
                """.formatted(id, name, cron), ScheduledJob.class);
    }

    @Test
    @DisplayName("POST /jobs creates a job and returns 201")
    void create() throws Exception {
        when(scheduler.createJob("digest", "0 9 * * *", "Send the digest"))
                .thenReturn(job("job_1", "digest", "0 9 * * *"));

        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new JobRequest("digest", "0 9 * * *", "Send the digest"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("job_1"))
                .andExpect(jsonPath("$.cronExpression").value("0 9 * * *"))
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    @DisplayName("POST /jobs with a missing field returns 400")
    void createMissingField() throws Exception {
        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"digest\",\"instruction\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("name, cron_expression and instruction are required"));

        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("POST /jobs with an invalid cron expression returns 400")
    void createInvalidCron() throws Exception {
        when(scheduler.createJob(anyString(), eq("x y z"), anyString()))
                .thenThrow(new InvalidCronExpressionException("x y z", "need 5 fields, got 3"));

        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"bad\",\"cron_expression\":\"x y z\",\"instruction\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid cron expression: \"x y z\" (need 5 fields, got 3)"));
    }

    @Test
    @DisplayName("POST /jobs beyond the job limit returns 429")
    void createOverLimit() throws Exception {
        when(scheduler.createJob(anyString(), anyString(), anyString()))
                .thenThrow(new CapacityExceededException("Max jobs reached (20)", 20));

        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"n\",\"cron_expression\":\"* * * * *\",\"instruction\":\"x\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Max jobs reached (20)"));
    }

    @Test
    @DisplayName("GET /jobs lists jobs")
    void list() throws Exception {
        when(scheduler.listJobs()).thenReturn(List.of(job("job_1", "digest", "0 9 * * *")));

        mockMvc.perform(get("/api/v1/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("digest"));
    }

    @Test
    @DisplayName("PATCH /jobs/{id} updates only given fields")
    void update() throws Exception {
        when(scheduler.updateJob("job_1", null, "30 9 * * *", null))
                .thenReturn(Optional.of(job("job_1", "digest", "30 9 * * *")));

        mockMvc.perform(patch("/api/v1/jobs/job_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cron_expression\":\"30 9 * * *\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cronExpression").value("30 9 * * *"));
    }

    @Test
    @DisplayName("POST /jobs/{id}/toggle enables or disables")
    void toggle() throws Exception {
        when(scheduler.toggleJob("job_1", false)).thenReturn(true);
        when(scheduler.toggleJob("job_x", true)).thenReturn(false);

        mockMvc.perform(post("/api/v1/jobs/job_1/toggle").param("enabled", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
        mockMvc.perform(post("/api/v1/jobs/job_x/toggle").param("enabled", "true"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /jobs/{id} returns 204 or 404")
    void deleteJob() throws Exception {
        when(scheduler.deleteJob("job_1")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/jobs/job_1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/jobs/job_x")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /jobs/{id}/run starts a session, or 409 when it cannot")
    void runNow() throws Exception {
        when(scheduler.getJob("job_1")).thenReturn(Optional.of(job("job_1", "digest", "0 9 * * *")));
        when(scheduler.runJobNow("job_1")).thenReturn(Optional.of("spawn_1"), Optional.empty());

        mockMvc.perform(post("/api/v1/jobs/job_1/run"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.run_id").value("spawn_1"));
        mockMvc.perform(post("/api/v1/jobs/job_1/run"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Job job_1 could not start a session"));
        mockMvc.perform(post("/api/v1/jobs/job_x/run"))
                .andExpect(status().isNotFound());
    }
}
