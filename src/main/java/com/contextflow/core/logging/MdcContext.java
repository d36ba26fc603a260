package com.contextflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing ContextFlow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setWorkflow(String workflowId) {
        MDC.put("workflowId", workflowId);
    }

    public static void setPhase(String workflowId, String phaseId, String context) {
        MDC.put("workflowId", workflowId);
        MDC.put("phaseId", phaseId);
        MDC.put("context", context);
    }

    public static void clearPhase() {
        MDC.remove("phaseId");
        MDC.remove("context");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("workflowId");
        MDC.remove("phaseId");
        MDC.remove("context");
    }
}
