package com.vibeloop.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing run-loop MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setIteration(String runId, int iteration) {
        MDC.put("runId", runId);
        MDC.put("iteration", String.valueOf(iteration));
    }

    public static void clearIteration() {
        MDC.remove("iteration");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("iteration");
    }
}
