package com.contextflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal, immutable summary of a workflow execution. Returned for every
 * execution, including total failure, so callers can inspect partial results.
 *
 * @param workflowId           the executed workflow
 * @param status               final status
 * @param results              phase id -> result bag for every phase that produced results
 * @param executionTimeSeconds wall-clock execution time
 * @param phasesExecuted       phases that completed, in completion order
 * @param phasesFailed         phases that failed, in failure order
 * @param errors               accumulated error messages
 * @param warnings             accumulated warnings
 * @param metrics              execution metrics, always containing "success_rate"
 * @param qualityScore         aggregate quality gate score in [0, 1], null when nothing completed
 * @param completedAt          when the result was produced
 */
public record WorkflowResult(
    String workflowId,
    WorkflowStatus status,
    Map<String, Map<String, Object>> results,
    double executionTimeSeconds,
    List<String> phasesExecuted,
    List<String> phasesFailed,
    List<String> errors,
    List<String> warnings,
    Map<String, Object> metrics,
    Double qualityScore,
    Instant completedAt
) implements Serializable {

    public WorkflowResult {
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        executionTimeSeconds = Math.max(0.0, executionTimeSeconds);
        phasesExecuted = phasesExecuted == null ? List.of() : List.copyOf(phasesExecuted);
        phasesFailed = phasesFailed == null ? List.of() : List.copyOf(phasesFailed);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        completedAt = completedAt == null ? Instant.now() : completedAt;
    }

    public double successRate() {
        Object value = metrics.get("success_rate");
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }
}
