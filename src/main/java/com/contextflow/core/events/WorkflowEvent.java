package com.contextflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * An event emitted while analyzing, composing or executing a workflow.
 * <p>
 * Event types are dotted names; the part before the dot is the category
 * ({@code task}, {@code workflow} or {@code phase}).
 *
 * @param eventType  event type, one of the constants below
 * @param workflowId the workflow (or task, for analysis events) this event belongs to
 * @param phaseId    the phase this event relates to (nullable for workflow-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record WorkflowEvent(
    String eventType,
    String workflowId,
    String phaseId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TASK_ANALYZED = "task.analyzed";
    public static final String WORKFLOW_COMPOSED = "workflow.composed";
    public static final String WORKFLOW_STARTED = "workflow.started";
    public static final String WORKFLOW_COMPLETED = "workflow.completed";
    public static final String WORKFLOW_FAILED = "workflow.failed";
    public static final String WORKFLOW_CANCELLED = "workflow.cancelled";
    public static final String PHASE_STARTED = "phase.started";
    public static final String PHASE_COMPLETED = "phase.completed";
    public static final String PHASE_FAILED = "phase.failed";
    public static final String PHASE_SKIPPED = "phase.skipped";
    public static final String PHASE_RECOVERY = "phase.recovery";

    private static final Set<String> OUTCOMES = Set.of(WORKFLOW_COMPLETED, WORKFLOW_FAILED, WORKFLOW_CANCELLED);

    public WorkflowEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public static WorkflowEvent of(String eventType, String workflowId, String phaseId, Map<String, Object> payload) {
        return new WorkflowEvent(eventType, workflowId, phaseId, payload, Instant.now());
    }

    /** "phase" for "phase.completed"; the whole type when it has no dot. */
    public String category() {
        int dot = eventType.indexOf('.');
        return dot < 0 ? eventType : eventType.substring(0, dot);
    }

    /** True for the last event of an execution: completed, failed or cancelled. */
    public boolean isOutcome() {
        return OUTCOMES.contains(eventType);
    }
}
