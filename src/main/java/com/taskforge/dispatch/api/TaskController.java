package com.taskforge.dispatch.api;

import com.taskforge.core.engine.AgentRunner;
import com.taskforge.core.queue.BackgroundTask;
import com.taskforge.core.queue.ResumeData;
import com.taskforge.core.queue.TaskQueue;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for background tasks.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskQueue taskQueue;
    private final AgentRunner agentRunner;
    private final SseStreamingService sseStreamingService;

    public TaskController(TaskQueue taskQueue, AgentRunner agentRunner, SseStreamingService sseStreamingService) {
        this.taskQueue = taskQueue;
        this.agentRunner = agentRunner;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/tasks: run an instruction in the background. 429 when the queue is full.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody TaskRequest request) {
        if (request.instruction() == null || request.instruction().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "instruction is required"));
        }
        String taskId = taskQueue.runInBackground(request.instruction(),
                request.history() == null ? List.of() : request.history(),
                request.attachments() == null ? List.of() : request.attachments(),
                agentRunner);
        return ResponseEntity.accepted().body(Map.of("task_id", taskId, "status", "running"));
    }

    @GetMapping
    public List<BackgroundTask> list() {
        return taskQueue.listTasks();
    }

    @GetMapping("/{id}")
    public ResponseEntity<BackgroundTask> get(@PathVariable String id) {
        return ResponseEntity.of(taskQueue.getTask(id));
    }

    @GetMapping("/{id}/resume-data")
    public ResponseEntity<ResumeData> resumeData(@PathVariable String id) {
        return ResponseEntity.of(taskQueue.getResumeData(id));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<Map<String, String>> pause(@PathVariable String id) {
        return transition(id, taskQueue.pauseTask(id), "paused");
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Map<String, String>> resume(@PathVariable String id) {
        return transition(id, taskQueue.resumeTask(id), "running");
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        return transition(id, taskQueue.cancelTask(id), "cancelled");
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String id) {
        if (taskQueue.getTask(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private ResponseEntity<Map<String, String>> transition(String id, boolean changed, String status) {
        if (changed) {
            return ResponseEntity.ok(Map.of("task_id", id, "status", status));
        }
        return taskQueue.getTask(id)
                .map(t -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                        "error", "Task " + id + " is " + t.getStatus().wireName())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
