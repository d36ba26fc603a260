package com.contextflow.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowEventRecorderTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private void run(String workflowId, String... phaseIds) {
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_STARTED, workflowId, null, Map.of()));
        for (String phaseId : phaseIds) {
            eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_STARTED, workflowId, phaseId, Map.of()));
            eventBus.publish(WorkflowEvent.of(WorkflowEvent.PHASE_COMPLETED, workflowId, phaseId, Map.of()));
        }
        eventBus.publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_COMPLETED, workflowId, null, Map.of()));
    }

    @Test
    @DisplayName("Records each workflow's events in publish order")
    void recordsTimeline() {
        var recorder = new WorkflowEventRecorder(eventBus, 100, 10);

        run("wf-1", "build", "verify");
        run("wf-2", "docs");

        List<String> types = recorder.history("wf-1").stream().map(WorkflowEvent::eventType).toList();
        assertEquals(List.of("workflow.started", "phase.started", "phase.completed",
                "phase.started", "phase.completed", "workflow.completed"), types);
        assertEquals(Map.of("workflow.started", 1, "phase.started", 1, "phase.completed", 1,
                "workflow.completed", 1), recorder.countsByType("wf-2"));
        assertTrue(recorder.history("wf-3").isEmpty());
    }

    @Test
    @DisplayName("A timeline keeps only the most recent events")
    void boundedTimeline() {
        var recorder = new WorkflowEventRecorder(eventBus, 3, 10);

        run("wf-1", "build", "verify");

        List<WorkflowEvent> history = recorder.history("wf-1");
        assertEquals(3, history.size());
        assertEquals("verify", history.get(0).phaseId());
        assertEquals(WorkflowEvent.WORKFLOW_COMPLETED, history.get(2).eventType());
    }

    @Test
    @DisplayName("The oldest finished timelines are evicted, running ones are kept")
    void evictsFinishedWorkflows() {
        var recorder = new WorkflowEventRecorder(eventBus, 100, 2);

        eventBus.publish(WorkflowEvent.of(WorkflowEvent.WORKFLOW_STARTED, "wf-running", null, Map.of()));
        run("wf-1", "build");
        run("wf-2", "build");
        run("wf-3", "build");

        assertTrue(recorder.history("wf-1").isEmpty());
        assertFalse(recorder.history("wf-2").isEmpty());
        assertFalse(recorder.history("wf-3").isEmpty());
        assertEquals(1, recorder.history("wf-running").size());
    }

    @Test
    @DisplayName("Closing the recorder stops recording")
    void close() {
        var recorder = new WorkflowEventRecorder(eventBus, 100, 10);
        recorder.close();

        run("wf-1", "build");

        assertTrue(recorder.trackedWorkflows().isEmpty());
        assertEquals(0, eventBus.subscriberCount());
    }
}
