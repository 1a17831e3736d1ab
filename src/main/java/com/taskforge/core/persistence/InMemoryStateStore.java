package com.taskforge.core.persistence;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link StateStore}; contents are lost on restart.
 */
public class InMemoryStateStore implements StateStore {

    private final ConcurrentHashMap<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> load(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void save(String key, String json) {
        values.put(key, json);
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }
}
