package com.taskforge.dispatch.api;

import com.taskforge.core.scheduler.CronScheduler;
import com.taskforge.core.scheduler.ScheduledJob;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for scheduled jobs. Invalid cron expressions come back as 400
 * through {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

    private final CronScheduler scheduler;

    public JobController(CronScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody JobRequest request) {
        if (isBlank(request.name()) || isBlank(request.cronExpression()) || isBlank(request.instruction())) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "name, cron_expression and instruction are required"));
        }
        ScheduledJob job = scheduler.createJob(request.name(), request.cronExpression(), request.instruction());
        return ResponseEntity.status(HttpStatus.CREATED).body(job);
    }

    @GetMapping
    public List<ScheduledJob> list() {
        return scheduler.listJobs();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScheduledJob> get(@PathVariable String id) {
        return ResponseEntity.of(scheduler.getJob(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ScheduledJob> update(@PathVariable String id, @RequestBody JobRequest request) {
        return ResponseEntity.of(scheduler.updateJob(id, request.name(), request.cronExpression(),
                request.instruction()));
    }

    @PostMapping("/{id}/toggle")
    public ResponseEntity<Map<String, Object>> toggle(@PathVariable String id, @RequestParam boolean enabled) {
        if (!scheduler.toggleJob(id, enabled)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("job_id", id, "enabled", enabled));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return scheduler.deleteJob(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    /**
     * POST /api/v1/jobs/{id}/run: start the job now. 409 when the session could not be spawned.
     */
    @PostMapping("/{id}/run")
    public ResponseEntity<Map<String, String>> runNow(@PathVariable String id) {
        if (scheduler.getJob(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return scheduler.runJobNow(id)
                .map(runId -> ResponseEntity.accepted().body(Map.of("job_id", id, "run_id", runId)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                        "error", "Job " + id + " could not start a session")));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
