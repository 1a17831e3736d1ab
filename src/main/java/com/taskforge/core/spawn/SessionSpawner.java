package com.taskforge.core.spawn;

import com.fasterxml.jackson.core.type.TypeReference;
import com.taskforge.core.concurrent.CancellationToken;
import com.taskforge.core.concurrent.CapacityExceededException;
import com.taskforge.core.concurrent.RunIds;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.events.TaskforgeEvent;
import com.taskforge.core.logging.MdcContext;
import com.taskforge.core.metrics.TaskforgeMetrics;
import com.taskforge.core.persistence.StateSnapshots;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs instructions in isolated sub-agent sessions.
 * <p>
 * {@link #spawn} admits a session synchronously (bounded by {@code maxConcurrent}
 * pending or running sessions), marks it running and hands the executor to the
 * worker pool. A per-session timer fails sessions that outlive their timeout.
 * Lifecycle events ({@code session.spawned}, {@code session.started},
 * {@code session.progress}, {@code session.completed}, {@code session.failed},
 * {@code session.cancelled}) go through the {@link EventBus}.
 */
@Service
public class SessionSpawner {

    private static final Logger log = LoggerFactory.getLogger(SessionSpawner.class);

    static final String SNAPSHOT_KEY = "taskforge.sessions";
    private static final Set<String> TERMINAL_EVENTS =
            Set.of("session.completed", "session.failed", "session.cancelled");

    private final SpawnerProperties properties;
    private final EventBus eventBus;
    private final StateSnapshots snapshots;
    private final TaskforgeMetrics metrics;
    private final ExecutorService workers;
    private final ScheduledExecutorService timers;
    private final Clock clock;

    private final Map<String, SpawnedSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> timeouts = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();
    private final Object snapshotLock = new Object();

    public SessionSpawner(SpawnerProperties properties,
                          EventBus eventBus,
                          StateSnapshots snapshots,
                          TaskforgeMetrics metrics,
                          @Qualifier("taskforgeWorkers") ExecutorService workers,
                          @Qualifier("taskforgeTimers") ScheduledExecutorService timers,
                          Clock clock) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.snapshots = snapshots;
        this.metrics = metrics;
        this.workers = workers;
        this.timers = timers;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        List<SpawnedSession> stored = snapshots.read(SNAPSHOT_KEY, new TypeReference<List<SpawnedSession>>() {})
                .orElse(List.of());
        int interrupted = 0;
        for (SpawnedSession session : stored) {
            if (session.getStatus().isActive() && session.fail("interrupted", clock.instant())) {
                interrupted++;
            }
            sessions.put(session.getRunId(), session);
        }
        if (!stored.isEmpty()) {
            log.info("Loaded {} sessions ({} marked interrupted)", stored.size(), interrupted);
            snapshot();
        }
    }

    @PreDestroy
    public void teardown() {
        timeouts.values().forEach(f -> f.cancel(false));
        timeouts.clear();
    }

    /**
     * Starts a new session and returns it immediately; the executor runs in the background.
     *
     * @throws CapacityExceededException when {@code maxConcurrent} sessions are already active
     */
    public SpawnedSession spawn(SpawnConfig config, SessionExecutor executor) {
        long timeoutMs = config.timeoutMs() != null && config.timeoutMs() > 0
                ? config.timeoutMs() : properties.getDefaultTimeoutMs();
        int maxIterations = config.maxIterations() != null && config.maxIterations() > 0
                ? config.maxIterations() : properties.getDefaultMaxIterations();

        SpawnedSession session;
        synchronized (admissionLock) {
            List<SpawnedSession> active = getActiveSessions();
            if (active.size() >= properties.getMaxConcurrent()) {
                String names = active.stream().map(SpawnedSession::getName).collect(Collectors.joining(", "));
                throw new CapacityExceededException(
                        "Max concurrent sessions reached (" + properties.getMaxConcurrent() + "). Active: " + names,
                        properties.getMaxConcurrent());
            }
            session = new SpawnedSession(RunIds.next("spawn", clock), config.name(), config.instruction(),
                    maxIterations, timeoutMs, clock.instant());
            sessions.put(session.getRunId(), session);
        }
        String runId = session.getRunId();
        publish("session.spawned", session, Map.of("name", session.getName()));

        session.start(clock.instant());
        snapshot();
        publish("session.started", session, Map.of());
        log.info("Spawned session \"{}\" as {}", session.getName(), runId);

        CancellationToken token = CancellationToken.create();
        tokens.put(runId, token);
        timeouts.put(runId, timers.schedule(() -> onTimeout(runId, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS));

        var context = new SessionContext(this, session, token);
        workers.submit(() -> execute(session, config, executor, context));
        return session;
    }

    private void execute(SpawnedSession session, SpawnConfig config, SessionExecutor executor,
                         SessionContext context) {
        MdcContext.setRun(session.getRunId());
        try {
            SessionOutcome outcome = executor.execute(session, config, context);
            if (session.complete(outcome, clock.instant())) {
                finish(session, "session.completed", Map.of("toolsUsed", outcome.toolsUsed()));
                log.info("Session \"{}\" ({}) completed in {} ms", session.getName(), session.getRunId(),
                        session.elapsed(clock.instant()).toMillis());
            }
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (session.failIfRunning(message, clock.instant())) {
                log.warn("Session \"{}\" ({}) failed: {}", session.getName(), session.getRunId(), message);
                finish(session, "session.failed", Map.of("error", message));
            }
        } finally {
            disarm(session.getRunId());
            MdcContext.clear();
        }
    }

    private void onTimeout(String runId, long timeoutMs) {
        SpawnedSession session = sessions.get(runId);
        if (session == null) {
            return;
        }
        String message = "Timeout after " + timeoutMs + " ms";
        if (session.failIfRunning(message, clock.instant())) {
            log.warn("Session \"{}\" ({}) timed out", session.getName(), runId);
            cancelToken(runId, message);
            finish(session, "session.failed", Map.of("error", message));
        }
    }

    void reportProgress(SpawnedSession session, int percent, String step) {
        if (session.updateProgress(percent, step)) {
            publish("session.progress", session, Map.of(
                    "progress", session.getProgress(),
                    "step", step == null ? "" : step));
        }
    }

    /**
     * Cancels a running session and trips its token. Returns false for unknown
     * sessions and for sessions that are not running.
     */
    public boolean cancel(String runId) {
        SpawnedSession session = sessions.get(runId);
        if (session == null || !session.cancel(clock.instant())) {
            return false;
        }
        cancelToken(runId, "Session cancelled");
        finish(session, "session.cancelled", Map.of());
        log.info("Session \"{}\" ({}) cancelled", session.getName(), runId);
        return true;
    }

    public SpawnedSession awaitCompletion(String runId) {
        return awaitCompletion(runId, Duration.ofMillis(properties.getAwaitTimeoutMs()));
    }

    /**
     * Blocks until the session reaches a terminal status. If {@code timeout} elapses
     * first, the session is failed with an await timeout and returned.
     *
     * @throws IllegalArgumentException if no session has this id
     */
    public SpawnedSession awaitCompletion(String runId, Duration timeout) {
        SpawnedSession session = sessions.get(runId);
        if (session == null) {
            throw new IllegalArgumentException("Session not found: " + runId);
        }
        if (session.getStatus().isTerminal()) {
            return session;
        }

        CompletableFuture<SpawnedSession> done = new CompletableFuture<>();
        EventBus.Subscription subscription = eventBus.subscribe(runId, event -> {
            if (TERMINAL_EVENTS.contains(event.eventType())) {
                done.complete(session);
            }
        });
        try {
            if (session.getStatus().isTerminal()) {
                return session;
            }
            return done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            String message = "Await timeout after " + timeout.toMillis() + " ms";
            if (session.fail(message, clock.instant())) {
                cancelToken(runId, message);
                finish(session, "session.failed", Map.of("error", message));
            }
            return session;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return session;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Waiting for session " + runId + " failed", e.getCause());
        } finally {
            subscription.unsubscribe();
        }
    }

    // -- Queries --

    public Optional<SpawnedSession> getSession(String runId) {
        return Optional.ofNullable(sessions.get(runId));
    }

    /**
     * All sessions, newest first.
     */
    public List<SpawnedSession> listSessions() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(SpawnedSession::getCreatedAt).reversed())
                .toList();
    }

    public List<SpawnedSession> getActiveSessions() {
        return sessions.values().stream()
                .filter(s -> s.getStatus().isActive())
                .sorted(Comparator.comparing(SpawnedSession::getCreatedAt))
                .toList();
    }

    public boolean canSpawnMore() {
        return getActiveSessions().size() < properties.getMaxConcurrent();
    }

    public SessionSummary getSummary() {
        List<SpawnedSession> all = listSessions();
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (SessionStatus status : SessionStatus.values()) {
            byStatus.put(status.wireName(), 0);
        }
        all.forEach(s -> byStatus.merge(s.getStatus().wireName(), 1, Integer::sum));
        List<String> activeNames = getActiveSessions().stream().map(SpawnedSession::getName).toList();
        return new SessionSummary(all.size(), byStatus, activeNames, render(all));
    }

    private String render(List<SpawnedSession> all) {
        if (all.isEmpty()) {
            return "No sub-agent sessions.";
        }
        Instant now = clock.instant();
        StringBuilder text = new StringBuilder("Sub-agent sessions (").append(all.size()).append("):");
        for (SpawnedSession s : all.subList(0, Math.min(10, all.size()))) {
            String label = switch (s.getStatus()) {
                case COMPLETED -> "DONE";
                case FAILED -> "FAIL";
                case RUNNING -> s.getProgress() + "%";
                default -> s.getStatus().name();
            };
            text.append("\n  [").append(label).append("] ").append(s.getName());
            if (s.getStartedAt() != null) {
                text.append(String.format(Locale.ROOT, " (%.1fs)", s.elapsed(now).toMillis() / 1000.0));
            }
            if (s.getSignature() != null) {
                text.append(" [signed]");
            }
            text.append(" - ").append(s.getCurrentStep());
        }
        return text.toString();
    }

    public int cleanup() {
        return cleanup(Duration.ofMillis(properties.getRetentionMs()));
    }

    /**
     * Removes terminal sessions that finished before {@code maxAge} ago.
     */
    public int cleanup(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<String> removed = new ArrayList<>();
        for (SpawnedSession s : sessions.values()) {
            Instant finishedAt = s.getCompletedAt() != null ? s.getCompletedAt() : s.getCreatedAt();
            if (s.getStatus().isTerminal() && finishedAt.isBefore(cutoff)) {
                removed.add(s.getRunId());
            }
        }
        removed.forEach(id -> {
            sessions.remove(id);
            tokens.remove(id);
        });
        if (!removed.isEmpty()) {
            snapshot();
        }
        return removed.size();
    }

    // -- Internals --

    private void finish(SpawnedSession session, String eventType, Map<String, Object> payload) {
        disarm(session.getRunId());
        snapshot();
        metrics.recordSessionResult(session.getStatus().wireName());
        publish(eventType, session, payload);
    }

    private void cancelToken(String runId, String reason) {
        CancellationToken token = tokens.get(runId);
        if (token != null) {
            token.cancel(reason);
        }
    }

    private void disarm(String runId) {
        ScheduledFuture<?> timer = timeouts.remove(runId);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private void publish(String type, SpawnedSession session, Map<String, Object> extra) {
        Map<String, Object> payload = new HashMap<>(extra);
        payload.put("name", session.getName());
        payload.put("status", session.getStatus().wireName());
        eventBus.publish(TaskforgeEvent.of(type, session.getRunId(), payload));
    }

    private void snapshot() {
        synchronized (snapshotLock) {
            snapshots.write(SNAPSHOT_KEY, new ArrayList<>(sessions.values()));
        }
    }
}
