package com.taskforge.core.intent;

import com.taskforge.core.capability.Capability;
import com.taskforge.core.capability.CapabilityRegistry;
import com.taskforge.core.model.Intent;
import com.taskforge.core.model.TaskAction;
import com.taskforge.core.model.TaskCompletion;
import com.taskforge.core.model.TaskStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskCompletionValidatorTest {

    private CapabilityRegistry registry;
    private TaskCompletionValidator validator;
    private Intent searchThenCreate;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
        validator = new TaskCompletionValidator(registry);
        searchThenCreate = Intent.of(List.of(
                new TaskStep(TaskAction.SEARCH, List.of("expert_search"), "find suppliers"),
                new TaskStep(TaskAction.CREATE, List.of("create_file"), "write the report")),
                Intent.ClassifiedBy.FALLBACK);
    }

    @Test
    @DisplayName("search alone leaves the create step missing")
    void searchOnly() {
        TaskCompletion completion = validator.validate(searchThenCreate, List.of("expert_search"));

        assertFalse(completion.complete());
        assertEquals(1, completion.completedSteps().size());
        assertEquals(TaskAction.CREATE, completion.missingSteps().get(0).action());
        assertEquals("create_file", completion.suggestedNextCapability());
    }

    @Test
    @DisplayName("a capability tagged with the step action satisfies it")
    void satisfiedByActionTag() {
        TaskCompletion completion = validator.validate(searchThenCreate,
                List.of("expert_search", "extract_table_to_excel"));

        assertTrue(completion.complete());
        assertTrue(completion.missingSteps().isEmpty());
        assertNull(completion.suggestedNextCapability());
    }

    @Test
    @DisplayName("registered capabilities contribute their declared actions")
    void registeredActions() {
        registry.register(new Capability() {
            @Override
            public String name() {
                return "write_docx";
            }

            @Override
            public Set<TaskAction> actions() {
                return Set.of(TaskAction.CREATE);
            }

            @Override
            public Object invoke(Map<String, Object> args) {
                return "ok";
            }
        });

        TaskCompletion completion = validator.validate(searchThenCreate, List.of("category_search", "write_docx"));

        assertTrue(completion.complete());
    }

    @Test
    @DisplayName("nothing executed means every step is missing, in order")
    void nothingExecuted() {
        TaskCompletion completion = validator.validate(searchThenCreate, List.of());

        assertEquals(List.of(TaskAction.SEARCH, TaskAction.CREATE),
                completion.missingSteps().stream().map(TaskStep::action).toList());
        assertEquals("expert_search", completion.suggestedNextCapability());
    }
}
