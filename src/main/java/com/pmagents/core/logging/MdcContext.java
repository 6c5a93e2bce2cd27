package com.pmagents.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing orchestration MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId) {
        MDC.put("executionId", executionId);
    }

    public static void setTask(String executionId, String taskId, String capability) {
        MDC.put("executionId", executionId);
        MDC.put("taskId", taskId);
        MDC.put("capability", capability);
    }

    public static void setLevel(String executionId, int level) {
        MDC.put("executionId", executionId);
        MDC.put("level", String.valueOf(level));
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("capability");
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("taskId");
        MDC.remove("capability");
        MDC.remove("level");
    }
}
