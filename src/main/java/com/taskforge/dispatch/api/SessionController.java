package com.taskforge.dispatch.api;

import com.taskforge.core.engine.AgentRunner;
import com.taskforge.core.spawn.SessionSpawner;
import com.taskforge.core.spawn.SessionSummary;
import com.taskforge.core.spawn.SpawnConfig;
import com.taskforge.core.spawn.SpawnedSession;
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
 * REST endpoints for spawned sessions, including an SSE stream of their lifecycle events.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final SessionSpawner spawner;
    private final AgentRunner agentRunner;
    private final SseStreamingService sseStreamingService;

    public SessionController(SessionSpawner spawner, AgentRunner agentRunner,
                             SseStreamingService sseStreamingService) {
        this.spawner = spawner;
        this.agentRunner = agentRunner;
        this.sseStreamingService = sseStreamingService;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> spawn(@RequestBody SpawnRequest request) {
        if (request.instruction() == null || request.instruction().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "instruction is required"));
        }
        String name = request.name() == null || request.name().isBlank() ? "session" : request.name();
        SpawnedSession session = spawner.spawn(
                new SpawnConfig(name, request.instruction(), request.timeoutMs(), request.maxIterations()),
                agentRunner);
        return ResponseEntity.accepted().body(Map.of(
                "run_id", session.getRunId(),
                "status", session.getStatus().wireName()));
    }

    @GetMapping
    public List<SpawnedSession> list() {
        return spawner.listSessions();
    }

    @GetMapping("/summary")
    public SessionSummary summary() {
        return spawner.getSummary();
    }

    @GetMapping("/{id}")
    public ResponseEntity<SpawnedSession> get(@PathVariable String id) {
        return ResponseEntity.of(spawner.getSession(id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        if (spawner.cancel(id)) {
            return ResponseEntity.ok(Map.of("run_id", id, "status", "cancelled"));
        }
        return spawner.getSession(id)
                .map(s -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                        "error", "Session " + id + " is " + s.getStatus().wireName())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/sessions/{id}/events: SSE stream of session events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String id) {
        if (spawner.getSession(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }
}
