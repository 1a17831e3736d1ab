package com.taskforge.core.router;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Call and token quota over a sliding time window, shared by all capabilities.
 */
public class SlidingWindowResourceManager implements ResourceManager {

    private final int maxCalls;
    private final long maxTokens;
    private final long windowMs;
    private final Clock clock;
    private final Deque<Usage> usage = new ArrayDeque<>();

    public SlidingWindowResourceManager(int maxCalls, long maxTokens, long windowMs, Clock clock) {
        this.maxCalls = maxCalls;
        this.maxTokens = maxTokens;
        this.windowMs = windowMs;
        this.clock = clock;
    }

    @Override
    public synchronized LimitCheck checkLimits(String capability, long estimatedTokens) {
        prune();
        if (maxCalls > 0 && usage.size() >= maxCalls) {
            return LimitCheck.deny(maxCalls + " calls per " + windowMs + " ms");
        }
        long tokens = usage.stream().mapToLong(Usage::tokens).sum();
        if (maxTokens > 0 && tokens + estimatedTokens > maxTokens) {
            return LimitCheck.deny(maxTokens + " tokens per " + windowMs + " ms");
        }
        return LimitCheck.allow();
    }

    @Override
    public synchronized void recordUsage(String capability, long tokens) {
        usage.addLast(new Usage(clock.millis(), tokens));
    }

    private void prune() {
        long cutoff = clock.millis() - windowMs;
        while (!usage.isEmpty() && usage.peekFirst().at() <= cutoff) {
            usage.removeFirst();
        }
    }

    private record Usage(long at, long tokens) {}
}
