package com.taskforge.core.concurrent;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared clock and thread pools for background tasks, spawned sessions, timers and audit hooks.
 */
@Configuration
public class ExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService taskforgeWorkers() {
        return Executors.newCachedThreadPool(named("taskforge-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService taskforgeTimers() {
        return Executors.newScheduledThreadPool(2, named("taskforge-timer"));
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
