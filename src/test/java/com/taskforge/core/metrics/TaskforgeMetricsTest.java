package com.taskforge.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskforgeMetricsTest {

    private SimpleMeterRegistry registry;
    private TaskforgeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TaskforgeMetrics(registry);
    }

    @Test
    @DisplayName("recordCapabilityCall records by capability and outcome")
    void recordCapabilityCall() {
        metrics.recordCapabilityCall("read_file", "success", 120);
        metrics.recordCapabilityCall("read_file", "error", 30);

        var success = registry.find("taskforge.capability.duration")
                .tag("capability", "read_file").tag("outcome", "success").timer();
        var error = registry.find("taskforge.capability.duration")
                .tag("capability", "read_file").tag("outcome", "error").timer();

        assertNotNull(success);
        assertNotNull(error);
        assertEquals(1, success.count());
        assertEquals(1, error.count());
    }

    @Test
    @DisplayName("cache hits and misses share one counter name")
    void cacheCounters() {
        metrics.recordCacheHit();
        metrics.recordCacheHit();
        metrics.recordCacheMiss();

        assertEquals(2.0, registry.find("taskforge.capability.cache").tag("result", "hit").counter().count());
        assertEquals(1.0, registry.find("taskforge.capability.cache").tag("result", "miss").counter().count());
    }

    @Test
    @DisplayName("rejections are tagged with their reason")
    void recordRejection() {
        metrics.recordRejection("path_traversal");

        var counter = registry.find("taskforge.capability.rejections").tag("reason", "path_traversal").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recovery attempts are tagged with strategy and outcome")
    void recordRecovery() {
        metrics.recordRecovery("retry_with_backoff", true);
        metrics.recordRecovery("abort", false);

        assertEquals(1.0, registry.find("taskforge.recovery.attempts")
                .tag("strategy", "retry_with_backoff").tag("recovered", "true").counter().count());
        assertEquals(1.0, registry.find("taskforge.recovery.attempts")
                .tag("strategy", "abort").tag("recovered", "false").counter().count());
    }

    @Test
    @DisplayName("recordLoopDetected counts by capability")
    void recordLoopDetected() {
        metrics.recordLoopDetected("web_search");

        assertEquals(1.0, registry.find("taskforge.capability.loops").tag("capability", "web_search").counter().count());
    }

    @Test
    @DisplayName("recordContinuationAttempts feeds a distribution summary")
    void recordContinuationAttempts() {
        metrics.recordContinuationAttempts(0);
        metrics.recordContinuationAttempts(3);

        var summary = registry.find("taskforge.react.continuations").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(3.0, summary.totalAmount());
    }

    @Test
    @DisplayName("task and session results increment by status tag")
    void recordResults() {
        metrics.recordTaskResult("completed");
        metrics.recordTaskResult("completed");
        metrics.recordSessionResult("failed");

        assertEquals(2.0, registry.find("taskforge.tasks.total").tag("status", "completed").counter().count());
        assertEquals(1.0, registry.find("taskforge.sessions.total").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("recordScheduledRun tags whether a session was spawned")
    void recordScheduledRun() {
        metrics.recordScheduledRun(true);
        metrics.recordScheduledRun(false);
        metrics.recordScheduledRun(false);

        assertEquals(1.0, registry.find("taskforge.scheduler.runs").tag("spawned", "true").counter().count());
        assertEquals(2.0, registry.find("taskforge.scheduler.runs").tag("spawned", "false").counter().count());
    }
}
