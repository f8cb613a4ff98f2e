package com.taskforest.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Taskforest-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setPhase(String runId, String phase) {
        MDC.put("runId", runId);
        MDC.put("phase", phase);
        MDC.remove("taskId");
    }

    public static void setTask(String taskId) {
        if (taskId == null) {
            MDC.remove("taskId");
        } else {
            MDC.put("taskId", taskId);
        }
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("phase");
        MDC.remove("taskId");
    }
}
