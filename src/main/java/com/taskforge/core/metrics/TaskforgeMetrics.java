package com.taskforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for capability routing and background execution.
 */
@Service
public class TaskforgeMetrics {

    private final MeterRegistry registry;

    public TaskforgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Capability routing ---

    public void recordCapabilityCall(String capability, String outcome, long ms) {
        Timer.builder("taskforge.capability.duration")
                .tag("capability", capability)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCacheHit() {
        Counter.builder("taskforge.capability.cache")
                .description("Capability result cache lookups")
                .tag("result", "hit")
                .register(registry)
                .increment();
    }

    public void recordCacheMiss() {
        Counter.builder("taskforge.capability.cache")
                .description("Capability result cache lookups")
                .tag("result", "miss")
                .register(registry)
                .increment();
    }

    public void recordRejection(String reason) {
        Counter.builder("taskforge.capability.rejections")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records one recovery attempt after a failed capability call.
     *
     * @param strategy  the strategy that was selected
     * @param recovered whether the strategy produced a usable result
     */
    public void recordRecovery(String strategy, boolean recovered) {
        Counter.builder("taskforge.recovery.attempts")
                .tag("strategy", strategy)
                .tag("recovered", String.valueOf(recovered))
                .register(registry)
                .increment();
    }

    public void recordLoopDetected(String capability) {
        Counter.builder("taskforge.capability.loops")
                .description("Repeated non-informative results escalated to a failure")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    // --- Agent runs ---

    public void recordContinuationAttempts(int attempts) {
        DistributionSummary.builder("taskforge.react.continuations")
                .register(registry)
                .record(attempts);
    }

    public void recordTaskResult(String status) {
        Counter.builder("taskforge.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSessionResult(String status) {
        Counter.builder("taskforge.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordScheduledRun(boolean spawned) {
        Counter.builder("taskforge.scheduler.runs")
                .tag("spawned", String.valueOf(spawned))
                .register(registry)
                .increment();
    }
}
