package com.taskforge.core.scheduler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.taskforge.core.concurrent.CapacityExceededException;
import com.taskforge.core.concurrent.RunIds;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.logging.MdcContext;
import com.taskforge.core.metrics.TaskforgeMetrics;
import com.taskforge.core.persistence.StateSnapshots;
import com.taskforge.core.spawn.SessionExecutor;
import com.taskforge.core.spawn.SessionSpawner;
import com.taskforge.core.spawn.SpawnConfig;
import com.taskforge.core.spawn.SpawnedSession;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Cron-driven job scheduler. Each due job runs as a spawned {@code cron:<name>} session.
 * <p>
 * {@link #tick()} runs every {@code checkIntervalMs}; a job that already ran within
 * {@code debounceMs} is skipped so one matching minute never fires twice.
 */
@Service
public class CronScheduler {

    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    static final String SNAPSHOT_KEY = "taskforge.jobs";
    static final int LOOKAHEAD_MINUTES = 48 * 60;
    private static final Set<String> TERMINAL_EVENTS =
            Set.of("session.completed", "session.failed", "session.cancelled");

    private final SchedulerProperties properties;
    private final SessionSpawner spawner;
    private final SessionExecutor sessionExecutor;
    private final EventBus eventBus;
    private final StateSnapshots snapshots;
    private final TaskforgeMetrics metrics;
    private final ScheduledExecutorService timers;
    private final Clock clock;
    private final ZoneId zone;

    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final Object jobsLock = new Object();
    private final Object snapshotLock = new Object();
    private volatile ScheduledFuture<?> ticker;

    public CronScheduler(SchedulerProperties properties,
                         SessionSpawner spawner,
                         SessionExecutor sessionExecutor,
                         EventBus eventBus,
                         StateSnapshots snapshots,
                         TaskforgeMetrics metrics,
                         @Qualifier("taskforgeTimers") ScheduledExecutorService timers,
                         Clock clock) {
        this.properties = properties;
        this.spawner = spawner;
        this.sessionExecutor = sessionExecutor;
        this.eventBus = eventBus;
        this.snapshots = snapshots;
        this.metrics = metrics;
        this.timers = timers;
        this.clock = clock;
        this.zone = properties.getZone() == null || properties.getZone().isBlank()
                ? clock.getZone() : ZoneId.of(properties.getZone());
    }

    @PostConstruct
    public void init() {
        snapshots.read(SNAPSHOT_KEY, new TypeReference<List<ScheduledJob>>() {})
                .orElse(List.of())
                .forEach(job -> jobs.put(job.getId(), job));
        if (!jobs.isEmpty()) {
            log.info("Loaded {} scheduled jobs", jobs.size());
        }
        start();
    }

    @PreDestroy
    public void teardown() {
        stop();
    }

    public void start() {
        if (!properties.isEnabled()) {
            log.info("Scheduler disabled");
            return;
        }
        synchronized (this) {
            if (ticker != null) {
                return;
            }
            long interval = properties.getCheckIntervalMs();
            ticker = timers.scheduleAtFixedRate(this::safeTick, interval, interval, TimeUnit.MILLISECONDS);
        }
        log.info("Scheduler started (interval: {} ms, jobs: {})", properties.getCheckIntervalMs(), jobs.size());
    }

    public void stop() {
        synchronized (this) {
            if (ticker == null) {
                return;
            }
            ticker.cancel(false);
            ticker = null;
        }
        log.info("Scheduler stopped");
    }

    public boolean isRunning() {
        return ticker != null;
    }

    // -- Cron evaluation --

    /**
     * Whether the expression matches the current minute. Invalid expressions never match.
     */
    public boolean shouldRunNow(String expression) {
        try {
            return CronExpression.parse(expression).matches(now());
        } catch (InvalidCronExpressionException e) {
            log.debug("Not running invalid cron expression {}", expression);
            return false;
        }
    }

    /**
     * First matching minute within the next 48 hours, or empty if none matches or the
     * expression is invalid.
     */
    public Optional<Instant> getNextRun(String expression) {
        CronExpression cron;
        try {
            cron = CronExpression.parse(expression);
        } catch (InvalidCronExpressionException e) {
            return Optional.empty();
        }
        ZonedDateTime base = now().truncatedTo(ChronoUnit.MINUTES);
        for (int offset = 1; offset <= LOOKAHEAD_MINUTES; offset++) {
            ZonedDateTime candidate = base.plusMinutes(offset);
            if (cron.matches(candidate)) {
                return Optional.of(candidate.toInstant());
            }
        }
        return Optional.empty();
    }

    // -- Jobs --

    /**
     * @throws InvalidCronExpressionException if the expression does not parse; nothing is added
     * @throws CapacityExceededException      if {@code maxJobs} jobs already exist
     */
    public ScheduledJob createJob(String name, String cronExpression, String instruction) {
        CronExpression.parse(cronExpression);
        ScheduledJob job;
        synchronized (jobsLock) {
            if (jobs.size() >= properties.getMaxJobs()) {
                throw new CapacityExceededException("Max jobs reached (" + properties.getMaxJobs() + ")",
                        properties.getMaxJobs());
            }
            job = new ScheduledJob(RunIds.next("job", clock), name, cronExpression, instruction, clock.instant());
            job.setNextRunAt(getNextRun(cronExpression).orElse(null));
            jobs.put(job.getId(), job);
        }
        snapshot();
        log.info("Created job \"{}\" ({}) as {}", name, cronExpression, job.getId());
        return job;
    }

    /**
     * Changes the given fields; null arguments keep the current value.
     *
     * @throws InvalidCronExpressionException if a new expression does not parse; the job is unchanged
     */
    public Optional<ScheduledJob> updateJob(String jobId, String name, String cronExpression, String instruction) {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        if (cronExpression != null) {
            CronExpression.parse(cronExpression);
        }
        job.update(name, cronExpression, instruction);
        job.setNextRunAt(job.isEnabled() ? getNextRun(job.getCronExpression()).orElse(null) : null);
        snapshot();
        return Optional.of(job);
    }

    public boolean deleteJob(String jobId) {
        boolean removed = jobs.remove(jobId) != null;
        if (removed) {
            snapshot();
            log.info("Deleted job {}", jobId);
        }
        return removed;
    }

    public boolean toggleJob(String jobId, boolean enabled) {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        job.setEnabled(enabled);
        job.setNextRunAt(enabled ? getNextRun(job.getCronExpression()).orElse(null) : null);
        snapshot();
        return true;
    }

    /**
     * All jobs, oldest first.
     */
    public List<ScheduledJob> listJobs() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(ScheduledJob::getCreatedAt))
                .toList();
    }

    public Optional<ScheduledJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Runs every enabled job whose expression matches the current minute.
     *
     * @return run ids of the sessions spawned
     */
    public List<String> tick() {
        ZonedDateTime now = now();
        List<String> spawned = new ArrayList<>();
        for (ScheduledJob job : listJobs()) {
            if (!job.isEnabled() || !matches(job, now)) {
                continue;
            }
            Instant lastRun = job.getLastRunAt();
            if (lastRun != null
                    && Duration.between(lastRun, now.toInstant()).toMillis() < properties.getDebounceMs()) {
                log.debug("Job {} ran at {}; skipping", job.getId(), lastRun);
                continue;
            }
            runJob(job).ifPresent(spawned::add);
        }
        return spawned;
    }

    /**
     * Runs a job immediately, regardless of its schedule and enabled flag.
     */
    public Optional<String> runJobNow(String jobId) {
        ScheduledJob job = jobs.get(jobId);
        return job == null ? Optional.empty() : runJob(job);
    }

    private Optional<String> runJob(ScheduledJob job) {
        MdcContext.setJob(job.getId());
        try {
            SpawnedSession session = spawner.spawn(
                    SpawnConfig.of("cron:" + job.getName(), job.getInstruction()), sessionExecutor);
            String runId = session.getRunId();
            job.recordRun(runId, clock.instant(), getNextRun(job.getCronExpression()).orElse(null));
            trackOutcome(job, runId);
            snapshot();
            metrics.recordScheduledRun(true);
            log.info("Job \"{}\" started session {}", job.getName(), runId);
            return Optional.of(runId);
        } catch (RuntimeException e) {
            metrics.recordScheduledRun(false);
            log.error("Failed to run job \"{}\": {}", job.getName(), e.getMessage());
            return Optional.empty();
        } finally {
            MdcContext.clear();
        }
    }

    private void trackOutcome(ScheduledJob job, String runId) {
        EventBus.Subscription[] holder = new EventBus.Subscription[1];
        holder[0] = eventBus.subscribe(runId, event -> {
            if (TERMINAL_EVENTS.contains(event.eventType())) {
                job.recordRunStatus(runId, event.eventType().substring("session.".length()));
                snapshot();
                if (holder[0] != null) {
                    holder[0].unsubscribe();
                }
            }
        });
        spawner.getSession(runId)
                .filter(s -> s.getStatus().isTerminal())
                .ifPresent(s -> {
                    job.recordRunStatus(runId, s.getStatus().wireName());
                    holder[0].unsubscribe();
                });
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    private boolean matches(ScheduledJob job, ZonedDateTime now) {
        try {
            return CronExpression.parse(job.getCronExpression()).matches(now);
        } catch (InvalidCronExpressionException e) {
            log.warn("Job {} has an invalid cron expression: {}", job.getId(), e.getMessage());
            return false;
        }
    }

    private ZonedDateTime now() {
        return clock.instant().atZone(zone);
    }

    private void snapshot() {
        synchronized (snapshotLock) {
            snapshots.write(SNAPSHOT_KEY, new ArrayList<>(jobs.values()));
        }
    }
}
