package com.contextflow.core.logging;

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
    @DisplayName("setPhase puts workflowId, phaseId and context in MDC")
    void setPhase() {
        MdcContext.setPhase("workflow_1", "workflow_1_implementation_0", "implementation");
        assertEquals("workflow_1", MDC.get("workflowId"));
        assertEquals("workflow_1_implementation_0", MDC.get("phaseId"));
        assertEquals("implementation", MDC.get("context"));
    }

    @Test
    @DisplayName("clearPhase keeps the workflow key")
    void clearPhase() {
        MdcContext.setPhase("workflow_1", "p", "design");
        MdcContext.clearPhase();
        assertEquals("workflow_1", MDC.get("workflowId"));
        assertNull(MDC.get("phaseId"));
        assertNull(MDC.get("context"));
    }

    @Test
    @DisplayName("clear removes all contextflow MDC keys")
    void clear() {
        MdcContext.setTask("task_1");
        MdcContext.setPhase("workflow_1", "p", "design");
        MdcContext.clear();
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("workflowId"));
        assertNull(MDC.get("phaseId"));
        assertNull(MDC.get("context"));
    }
}
