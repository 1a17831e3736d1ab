package com.taskforge.core.router;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recent calls per capability, restricted to a short time window, used to spot
 * a capability answering the same empty result over and over.
 */
class CallHistory {

    private final int perCapability;
    private final long windowMs;
    private final int maxCapabilities;
    private final LinkedHashMap<String, Deque<Entry>> calls;

    CallHistory(int perCapability, long windowMs, int maxCapabilities) {
        this.perCapability = perCapability;
        this.windowMs = windowMs;
        this.maxCapabilities = maxCapabilities;
        this.calls = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Deque<Entry>> eldest) {
                return size() > CallHistory.this.maxCapabilities;
            }
        };
    }

    /**
     * Appends a call and returns the capability's history after pruning, oldest first.
     */
    synchronized List<Entry> record(String capability, String serializedResult, boolean nonInformative, long now) {
        Deque<Entry> deque = calls.get(capability);
        if (deque == null) {
            deque = new ArrayDeque<>();
            calls.put(capability, deque);
        }
        deque.removeIf(e -> now - e.timestamp() >= windowMs);
        deque.addLast(new Entry(serializedResult, nonInformative, now));
        while (deque.size() > perCapability) {
            deque.removeFirst();
        }
        return List.copyOf(deque);
    }

    synchronized int size() {
        return calls.size();
    }

    record Entry(String serializedResult, boolean nonInformative, long timestamp) {}
}
