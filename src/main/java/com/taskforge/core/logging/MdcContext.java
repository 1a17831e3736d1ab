package com.taskforge.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing Taskforge MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_ID = "taskId";
    public static final String CAPABILITY = "capability";
    public static final String JOB_ID = "jobId";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String taskId) {
        MDC.put(RUN_ID, taskId);
        MDC.put(TASK_ID, taskId);
    }

    public static void setJob(String jobId) {
        MDC.put(JOB_ID, jobId);
    }

    public static void setCapability(String capability) {
        MDC.put(CAPABILITY, capability);
    }

    public static void clearCapability() {
        MDC.remove(CAPABILITY);
    }

    /** Run id of the current thread, or {@code "default"} outside any run. */
    public static String currentRunId() {
        String runId = MDC.get(RUN_ID);
        return runId != null ? runId : "default";
    }

    /** Copy of the current thread's MDC, for handing work to another thread. */
    public static Map<String, String> copy() {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return context != null ? context : Map.of();
    }

    public static void restore(Map<String, String> context) {
        MDC.setContextMap(context);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_ID);
        MDC.remove(CAPABILITY);
        MDC.remove(JOB_ID);
    }
}
