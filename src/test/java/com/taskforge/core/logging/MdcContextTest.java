package com.taskforge.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("spawn_1");
        assertEquals("spawn_1", MDC.get("runId"));
        assertEquals("spawn_1", MdcContext.currentRunId());
    }

    @Test
    @DisplayName("setTask puts the task id under runId and taskId")
    void setTask() {
        MdcContext.setTask("task_1");
        assertEquals("task_1", MDC.get("runId"));
        assertEquals("task_1", MDC.get("taskId"));
    }

    @Test
    @DisplayName("currentRunId falls back to default")
    void defaultRunId() {
        assertEquals("default", MdcContext.currentRunId());
    }

    @Test
    @DisplayName("capability can be cleared on its own")
    void capability() {
        MdcContext.setRun("spawn_1");
        MdcContext.setCapability("read_file");
        assertEquals("read_file", MDC.get("capability"));

        MdcContext.clearCapability();
        assertNull(MDC.get("capability"));
        assertEquals("spawn_1", MDC.get("runId"));
    }

    @Test
    @DisplayName("clear removes all taskforge MDC keys")
    void clear() {
        MdcContext.setTask("task_1");
        MdcContext.setJob("job_1");
        MdcContext.setCapability("read_file");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("capability"));
    }
}
