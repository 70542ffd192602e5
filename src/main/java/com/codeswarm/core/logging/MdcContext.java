package com.codeswarm.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing CodeSwarm-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID    = "runId";
    public static final String ITERATION = "iteration";
    public static final String PHASE     = "phase";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setPhase(int iteration, String phase) {
        MDC.put(ITERATION, String.valueOf(iteration));
        MDC.put(PHASE, phase);
    }

    /** Snapshot to hand to a worker thread. May be null. */
    public static Map<String, String> capture() {
        return MDC.getCopyOfContextMap();
    }

    public static void restore(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(ITERATION);
        MDC.remove(PHASE);
    }
}
