package com.auditlead.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing audit-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String AGENT_NAME = "agentName";
    public static final String PHASE = "phase";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setPhase(String runId, String phase) {
        MDC.put(RUN_ID, runId);
        MDC.put(PHASE, phase);
    }

    public static void setAgent(String runId, String agentName, String phase) {
        MDC.put(RUN_ID, runId);
        MDC.put(AGENT_NAME, agentName);
        if (phase != null) {
            MDC.put(PHASE, phase);
        }
    }

    public static void clearPhase() {
        MDC.remove(PHASE);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(AGENT_NAME);
        MDC.remove(PHASE);
    }
}
