package com.taskforge.core.capability;

import com.taskforge.core.model.TaskAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRegistryTest {

    private CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
    }

    @Test
    @DisplayName("registered capabilities are found by name in registration order")
    void registerAndFind() {
        registry.register(capability("web_search", "Search the web", Set.of(TaskAction.SEARCH)));
        registry.register(capability("create_file", "Write a file", Set.of()));

        assertTrue(registry.find("web_search").isPresent());
        assertEquals(List.of("web_search", "create_file"), registry.names());
    }

    @Test
    @DisplayName("re-registering a name replaces the implementation")
    void reRegisterReplaces() {
        registry.register(capability("web_search", "old", Set.of()));
        registry.register(capability("web_search", "new", Set.of()));

        assertEquals(1, registry.all().size());
        assertEquals("new", registry.require("web_search").description());
    }

    @Test
    @DisplayName("require throws for an unknown name")
    void requireUnknown() {
        var ex = assertThrows(UnknownCapabilityException.class, () -> registry.require("teleport"));
        assertEquals("Unknown capability: teleport", ex.getMessage());
    }

    @Test
    @DisplayName("unregister reports whether anything was removed")
    void unregister() {
        registry.register(capability("web_search", "", Set.of()));

        assertTrue(registry.unregister("web_search"));
        assertFalse(registry.unregister("web_search"));
        assertTrue(registry.names().isEmpty());
    }

    @Test
    @DisplayName("descriptors list action wire names sorted")
    void descriptors() {
        registry.register(capability("execute_code", "Run code",
                Set.of(TaskAction.TRANSFORM, TaskAction.CALCULATE)));

        CapabilityDescriptor descriptor = registry.descriptors().get(0);
        assertEquals("execute_code", descriptor.name());
        assertEquals(List.of("calculate", "transform"), descriptor.actions());
    }

    @Test
    @DisplayName("action tags merge the declaration with the built-in table")
    void actionsForMerges() {
        registry.register(capability("create_file", "", Set.of(TaskAction.TRANSFORM)));

        Set<TaskAction> tags = registry.actionsFor("create_file");

        assertTrue(tags.contains(TaskAction.TRANSFORM));
        assertTrue(tags.contains(TaskAction.CREATE));
        assertTrue(registry.actionsFor("expert_search").contains(TaskAction.SEARCH));
        assertTrue(registry.actionsFor("unheard_of").isEmpty());
    }

    private static Capability capability(String name, String description, Set<TaskAction> actions) {
        return new Capability() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String description() {
                return description;
            }

            @Override
            public Set<TaskAction> actions() {
                return actions;
            }

            @Override
            public Object invoke(Map<String, Object> args) {
                return Map.of("ok", true);
            }
        };
    }
}
