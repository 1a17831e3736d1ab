package com.taskforge.core.capability;

import com.taskforge.core.intent.ActionPatternTable;
import com.taskforge.core.model.TaskAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name-keyed registry of {@link Capability} implementations.
 * <p>
 * Every Spring bean implementing {@link Capability} is registered at startup;
 * more can be added at runtime with {@link #register(Capability)}.
 */
@Service
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, Capability> capabilities = new LinkedHashMap<>();

    public CapabilityRegistry() {
    }

    @Autowired
    public CapabilityRegistry(ObjectProvider<Capability> beans) {
        beans.orderedStream().forEach(this::register);
    }

    public synchronized void register(Capability capability) {
        Capability previous = capabilities.put(capability.name(), capability);
        if (previous != null) {
            log.warn("Capability {} re-registered; previous implementation replaced", capability.name());
        } else {
            log.debug("Registered capability {}", capability.name());
        }
    }

    public synchronized boolean unregister(String name) {
        return capabilities.remove(name) != null;
    }

    public synchronized Optional<Capability> find(String name) {
        return Optional.ofNullable(capabilities.get(name));
    }

    public Capability require(String name) {
        return find(name).orElseThrow(() -> new UnknownCapabilityException(name));
    }

    public synchronized List<String> names() {
        return List.copyOf(capabilities.keySet());
    }

    public synchronized List<CapabilityDescriptor> descriptors() {
        List<CapabilityDescriptor> result = new ArrayList<>();
        for (Capability c : capabilities.values()) {
            result.add(new CapabilityDescriptor(c.name(), c.description(),
                    c.actions().stream().map(TaskAction::wireName).sorted().toList()));
        }
        return result;
    }

    /**
     * Action categories a capability is tagged with: its own declaration merged with
     * the built-in fallback table, so unregistered well-known names still count.
     */
    public Set<TaskAction> actionsFor(String name) {
        Set<TaskAction> tags = EnumSet.noneOf(TaskAction.class);
        find(name).ifPresent(c -> tags.addAll(c.actions()));
        tags.addAll(ActionPatternTable.actionsFor(name));
        return tags;
    }

    public synchronized Collection<Capability> all() {
        return List.copyOf(capabilities.values());
    }
}
