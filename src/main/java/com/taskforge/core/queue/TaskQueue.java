package com.taskforge.core.queue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.taskforge.core.concurrent.CancellationToken;
import com.taskforge.core.concurrent.CapacityExceededException;
import com.taskforge.core.concurrent.RunIds;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.events.TaskforgeEvent;
import com.taskforge.core.logging.MdcContext;
import com.taskforge.core.metrics.TaskforgeMetrics;
import com.taskforge.core.model.TranscriptEntry;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry and runner for long-running background tasks.
 * <p>
 * Admission is bounded by {@code maxConcurrent} active (queued or running) tasks.
 * Each started task runs on the worker pool with a watchdog on the timer pool that
 * fails it if it is still running once {@code taskTimeoutMs} elapses; resuming a
 * paused task re-arms a watchdog that fired while it was paused. The registry is snapshotted to the
 * {@link StateSnapshots} store after every mutation; on startup any task that was
 * still queued or running is marked failed as interrupted and never resumed.
 */
@Service
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    static final String SNAPSHOT_KEY = "taskforge.tasks";
    static final String INTERRUPTED = "interrupted";

    private final TaskQueueProperties properties;
    private final EventBus eventBus;
    private final StateSnapshots snapshots;
    private final TaskforgeMetrics metrics;
    private final ExecutorService workers;
    private final ScheduledExecutorService timers;
    private final Clock clock;

    private final Map<String, BackgroundTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> watchdogs = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();
    private final Object snapshotLock = new Object();

    public TaskQueue(TaskQueueProperties properties,
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
        List<BackgroundTask> stored = snapshots.read(SNAPSHOT_KEY, new TypeReference<List<BackgroundTask>>() {})
                .orElse(List.of());
        int interrupted = 0;
        for (BackgroundTask task : stored) {
            TaskStatus status = task.getStatus();
            if ((status == TaskStatus.QUEUED || status == TaskStatus.RUNNING) && task.fail(INTERRUPTED, now())) {
                interrupted++;
            }
            tasks.put(task.getId(), task);
        }
        if (!stored.isEmpty()) {
            log.info("Loaded {} background tasks ({} marked interrupted)", stored.size(), interrupted);
            snapshot();
        }
    }

    @PreDestroy
    public void teardown() {
        watchdogs.values().forEach(f -> f.cancel(false));
        watchdogs.clear();
    }

    // -- Lifecycle --

    public BackgroundTask enqueue(String instruction) {
        return enqueue(instruction, properties.getDefaultMaxIterations());
    }

    public BackgroundTask enqueue(String instruction, int maxIterations) {
        return enqueue(instruction, List.of(), List.of(), maxIterations);
    }

    public BackgroundTask enqueue(String instruction, List<TranscriptEntry> history,
                                  List<String> attachments, int maxIterations) {
        var task = new BackgroundTask(RunIds.next("task", clock), instruction, history, attachments,
                maxIterations > 0 ? maxIterations : properties.getDefaultMaxIterations(), now());
        tasks.put(task.getId(), task);
        snapshot();
        log.info("Enqueued task {}: \"{}\"", task.getId(), abbreviate(instruction));
        publish("task.queued", task, Map.of("instruction", instruction));
        return task;
    }

    /**
     * Admits a task and runs it on the worker pool.
     *
     * @return the new task id
     * @throws CapacityExceededException when {@code maxConcurrent} tasks are already active
     */
    public String runInBackground(String instruction, TaskExecutor executor) {
        return runInBackground(instruction, List.of(), List.of(), executor);
    }

    public String runInBackground(String instruction, List<TranscriptEntry> history,
                                  List<String> attachments, TaskExecutor executor) {
        BackgroundTask task;
        synchronized (admissionLock) {
            List<BackgroundTask> active = getActiveTasks();
            if (active.size() >= properties.getMaxConcurrent()) {
                throw new CapacityExceededException(
                        "Task queue is full (" + properties.getMaxConcurrent()
                                + " tasks). Wait for running tasks to finish.",
                        properties.getMaxConcurrent());
            }
            task = enqueue(instruction, history, attachments, properties.getDefaultMaxIterations());
            task.transitionTo(TaskStatus.RUNNING, "Running in background", now());
        }
        snapshot();
        publish("task.started", task, Map.of());

        CancellationToken token = CancellationToken.create();
        tokens.put(task.getId(), token);
        arm(task.getId());

        var context = new TaskContext(this, task, token);
        workers.submit(() -> execute(task, executor, context));
        return task.getId();
    }

    private void execute(BackgroundTask task, TaskExecutor executor, TaskContext context) {
        MdcContext.setTask(task.getId());
        try {
            TaskResult result = executor.execute(task, context);
            completeTask(task.getId(), result);
        } catch (CancellationException e) {
            log.info("Task {} stopped after cancellation: {}", task.getId(), e.getMessage());
            failTask(task.getId(), e.getMessage() != null ? e.getMessage() : "cancelled");
        } catch (Exception e) {
            log.warn("Task {} failed: {}", task.getId(), e.getMessage(), e);
            failTask(task.getId(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            disarm(task.getId());
            MdcContext.clear();
        }
    }

    private void onTimeout(String taskId) {
        BackgroundTask task = tasks.get(taskId);
        if (task == null || task.getStatus() != TaskStatus.RUNNING) {
            return;
        }
        long minutes = Duration.ofMillis(properties.getTaskTimeoutMs()).toMinutes();
        String message = minutes > 0
                ? "Timeout after " + minutes + " min"
                : "Timeout after " + properties.getTaskTimeoutMs() + " ms";
        log.warn("Task {} timed out", taskId);
        CancellationToken token = tokens.get(taskId);
        if (token != null) {
            token.cancel(message);
        }
        failTask(taskId, message);
    }

    void reportIteration(BackgroundTask task, int percent, String step) {
        int iteration = task.nextIteration();
        updateProgress(task.getId(), percent, step);
        if (properties.getCheckpointInterval() > 0 && iteration % properties.getCheckpointInterval() == 0) {
            Map<String, Object> state = new HashMap<>();
            state.put("progress", percent);
            state.put("step", step);
            saveCheckpoint(task.getId(), iteration, List.of(), state);
        }
    }

    public boolean updateProgress(String taskId, int percent, String step) {
        BackgroundTask task = tasks.get(taskId);
        if (task == null || !task.updateProgress(percent, step, now())) {
            return false;
        }
        publish("task.progress", task, Map.of(
                "progress", task.getProgress(),
                "step", step == null ? "" : step,
                "message", "[" + task.getProgress() + "%] " + step));
        return true;
    }

    /**
     * Stores a checkpoint. Returns false for an unknown or finished task, or when
     * {@code iteration} is not greater than the last stored checkpoint's.
     */
    public boolean saveCheckpoint(String taskId, int iteration, List<TranscriptEntry> transcript,
                                  Map<String, Object> partialResults) {
        BackgroundTask task = tasks.get(taskId);
        if (task == null) {
            return false;
        }
        var checkpoint = new Checkpoint(iteration, transcript, partialResults, now());
        if (!task.acceptCheckpoint(checkpoint, now())) {
            log.warn("Rejected checkpoint for task {} at iteration {} (status {})",
                    taskId, iteration, task.getStatus().wireName());
            return false;
        }
        snapshot();
        log.debug("Checkpoint saved for task {} at iteration {}", taskId, iteration);
        publish("task.checkpoint", task, Map.of("iteration", iteration));
        return true;
    }

    public boolean completeTask(String taskId, TaskResult result) {
        BackgroundTask task = tasks.get(taskId);
        if (task == null || !task.complete(result, now())) {
            return false;
        }
        finish(task, "task.completed", Map.of());
        log.info("Task {} completed", taskId);
        return true;
    }

    public boolean failTask(String taskId, String error) {
        BackgroundTask task = tasks.get(taskId);
        if (task == null || !task.fail(error, now())) {
            return false;
        }
        finish(task, "task.failed", Map.of("error", error == null ? "" : error));
        log.info("Task {} failed: {}", taskId, error);
        return true;
    }

    public boolean cancelTask(String taskId) {
        BackgroundTask task = tasks.get(taskId);
        if (task == null || !task.transitionTo(TaskStatus.CANCELLED, "Cancelled", now())) {
            return false;
        }
        CancellationToken token = tokens.get(taskId);
        if (token != null) {
            token.cancel("Task cancelled");
        }
        finish(task, "task.cancelled", Map.of());
        log.info("Task {} cancelled", taskId);
        return true;
    }

    public boolean pauseTask(String taskId) {
        BackgroundTask task = tasks.get(taskId);
        if (task == null || task.getStatus() != TaskStatus.RUNNING
                || !task.transitionTo(TaskStatus.PAUSED, "Paused", now())) {
            return false;
        }
        snapshot();
        publish("task.paused", task, Map.of());
        return true;
    }

    public boolean resumeTask(String taskId) {
        BackgroundTask task = tasks.get(taskId);
        if (task == null || task.getStatus() != TaskStatus.PAUSED
                || !task.transitionTo(TaskStatus.RUNNING, "Resumed", now())) {
            return false;
        }
        if (tokens.containsKey(taskId)) {
            ScheduledFuture<?> watchdog = watchdogs.get(taskId);
            if (watchdog == null || watchdog.isDone()) {
                arm(taskId);
            }
        }
        snapshot();
        publish("task.resumed", task, Map.of());
        return true;
    }

    /**
     * Returns what is needed to restart a task from its last checkpoint, without
     * changing the task.
     */
    public Optional<ResumeData> getResumeData(String taskId) {
        BackgroundTask task = tasks.get(taskId);
        if (task == null || task.getCheckpoint() == null) {
            return Optional.empty();
        }
        Checkpoint checkpoint = task.getCheckpoint();
        return Optional.of(new ResumeData(task.getInstruction(), task.getHistory(), checkpoint,
                Math.max(0, task.getMaxIterations() - checkpoint.iteration())));
    }

    // -- Queries --

    public Optional<BackgroundTask> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * All tasks, newest first.
     */
    public List<BackgroundTask> listTasks() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(BackgroundTask::getCreatedAt).reversed())
                .toList();
    }

    public List<BackgroundTask> getActiveTasks() {
        return tasks.values().stream()
                .filter(t -> t.getStatus() == TaskStatus.QUEUED || t.getStatus() == TaskStatus.RUNNING)
                .toList();
    }

    public boolean canAcceptMore() {
        return getActiveTasks().size() < properties.getMaxConcurrent();
    }

    public boolean shouldRunAsBackground(String instruction, int estimatedSteps) {
        return estimatedSteps > 5 || (instruction != null && instruction.length() > 500);
    }

    public int cleanup() {
        return cleanup(Duration.ofMillis(properties.getRetentionMs()));
    }

    /**
     * Removes terminal tasks last updated before {@code maxAge} ago.
     *
     * @return number of tasks removed
     */
    public int cleanup(Duration maxAge) {
        Instant cutoff = now().minus(maxAge);
        List<String> removed = new ArrayList<>();
        for (BackgroundTask task : tasks.values()) {
            if (task.getStatus().isTerminal() && task.getUpdatedAt().isBefore(cutoff)) {
                removed.add(task.getId());
            }
        }
        removed.forEach(id -> {
            tasks.remove(id);
            tokens.remove(id);
        });
        if (!removed.isEmpty()) {
            snapshot();
            log.info("Cleaned up {} finished tasks", removed.size());
        }
        return removed.size();
    }

    // -- Internals --

    private void finish(BackgroundTask task, String eventType, Map<String, Object> payload) {
        disarm(task.getId());
        snapshot();
        metrics.recordTaskResult(task.getStatus().wireName());
        publish(eventType, task, payload);
    }

    private void arm(String taskId) {
        watchdogs.put(taskId, timers.schedule(() -> onTimeout(taskId),
                properties.getTaskTimeoutMs(), TimeUnit.MILLISECONDS));
    }

    private void disarm(String taskId) {
        ScheduledFuture<?> watchdog = watchdogs.remove(taskId);
        if (watchdog != null) {
            watchdog.cancel(false);
        }
    }

    private void publish(String type, BackgroundTask task, Map<String, Object> extra) {
        Map<String, Object> payload = new HashMap<>(extra);
        payload.put("status", task.getStatus().wireName());
        eventBus.publish(TaskforgeEvent.of(type, task.getId(), payload));
    }

    /**
     * Serializes and stores the registry under one lock, so a store write never
     * carries an older view than the write before it.
     */
    private void snapshot() {
        synchronized (snapshotLock) {
            snapshots.write(SNAPSHOT_KEY, new ArrayList<>(tasks.values()));
        }
    }

    private Instant now() {
        return clock.instant();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
