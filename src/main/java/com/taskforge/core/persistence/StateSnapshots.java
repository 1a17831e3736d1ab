package com.taskforge.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Best-effort JSON snapshots on top of a {@link StateStore}. Read and write failures
 * are logged and reported as "nothing loaded" / "not saved", never thrown.
 */
public class StateSnapshots {

    private static final Logger log = LoggerFactory.getLogger(StateSnapshots.class);

    private final StateStore store;
    private final ObjectMapper mapper;

    public StateSnapshots(StateStore store) {
        this.store = store;
        this.mapper = new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public <T> Optional<T> read(String key, TypeReference<T> type) {
        try {
            Optional<String> json = store.load(key);
            if (json.isEmpty() || json.get().isBlank()) {
                return Optional.empty();
            }
            return Optional.ofNullable(mapper.readValue(json.get(), type));
        } catch (Exception e) {
            log.warn("Could not load snapshot '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean write(String key, Object value) {
        try {
            store.save(key, mapper.writeValueAsString(value));
            return true;
        } catch (Exception e) {
            log.warn("Could not save snapshot '{}': {}", key, e.getMessage());
            return false;
        }
    }
}
