package com.dagrun.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing dagrun MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setTask(String runId, String task, String phase) {
        MDC.put("runId", runId);
        MDC.put("task", task);
        MDC.put("phase", phase);
    }

    public static void clearTask() {
        MDC.remove("task");
        MDC.remove("phase");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("task");
        MDC.remove("phase");
    }
}
