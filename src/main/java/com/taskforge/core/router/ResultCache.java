package com.taskforge.core.router;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded capability result cache. Eviction follows insertion order only;
 * reads do not refresh an entry.
 */
public class ResultCache {

    private final int maxEntries;
    private final LinkedHashMap<String, Object> entries;

    public ResultCache(int maxEntries) {
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Object> eldest) {
                return size() > ResultCache.this.maxEntries;
            }
        };
    }

    public synchronized Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized void put(String key, Object value) {
        entries.put(key, value);
    }

    public synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized List<String> keys() {
        return List.copyOf(entries.keySet());
    }

    public synchronized void clear() {
        entries.clear();
    }
}
