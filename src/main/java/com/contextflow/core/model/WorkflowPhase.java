package com.contextflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One unit of work within a workflow, bound to exactly one context.
 *
 * @param phaseId        identifier, unique within the workflow
 * @param context        context id; must resolve to a known context to pass validation
 * @param name           human-readable name
 * @param description    what the phase does
 * @param inputs         input keys read from the workflow context data
 * @param outputs        result keys the phase must produce
 * @param condition      optional guard, null when the phase always runs
 * @param timeoutSeconds hard execution timeout
 * @param retryCount     maximum re-attempts on recoverable failure
 * @param qualityGates   named acceptance checks
 * @param parallelGroup  group tag for concurrent execution, null when sequential
 */
public record WorkflowPhase(
    String phaseId,
    String context,
    String name,
    String description,
    List<String> inputs,
    List<String> outputs,
    PhaseCondition condition,
    int timeoutSeconds,
    int retryCount,
    List<String> qualityGates,
    String parallelGroup
) implements Serializable {

    public WorkflowPhase {
        if (phaseId == null || phaseId.isBlank()) {
            throw new IllegalArgumentException("Phase id must not be blank");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Phase " + phaseId + " timeout must be positive: " + timeoutSeconds);
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("Phase " + phaseId + " retry count must not be negative: " + retryCount);
        }
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        qualityGates = qualityGates == null ? List.of() : List.copyOf(qualityGates);
        name = name == null ? phaseId : name;
        description = description == null ? "" : description;
    }

    public WorkflowPhase withParallelGroup(String group) {
        return new WorkflowPhase(phaseId, context, name, description, inputs, outputs,
                condition, timeoutSeconds, retryCount, qualityGates, group);
    }

    public WorkflowPhase withPhaseId(String id) {
        return new WorkflowPhase(id, context, name, description, inputs, outputs,
                condition, timeoutSeconds, retryCount, qualityGates, parallelGroup);
    }

    public boolean isParallel() {
        return parallelGroup != null && !parallelGroup.isBlank();
    }
}
