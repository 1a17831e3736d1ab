package com.taskforge.core.persistence;

import java.util.Optional;

/**
 * Key-value blob store used to snapshot task, session and job registries.
 * Values are JSON documents.
 */
public interface StateStore {

    Optional<String> load(String key);

    void save(String key, String json);

    void delete(String key);
}
