package com.contextflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only blueprint of a workflow. The orchestrator never mutates it;
 * the composer produces new instances when it reorders or repairs.
 *
 * @param workflowId               workflow identifier
 * @param name                     display name
 * @param description              what the workflow accomplishes
 * @param phases                   phases in execution order, never empty
 * @param dependencies             phase id -> ids of the phases it depends on
 * @param estimatedDurationMinutes estimated total duration
 * @param qualityGates             workflow-level acceptance checks
 * @param metadata                 composition details (template used, validation outcome, ...)
 * @param createdAt                creation timestamp
 */
public record WorkflowDefinition(
    String workflowId,
    String name,
    String description,
    List<WorkflowPhase> phases,
    Map<String, List<String>> dependencies,
    int estimatedDurationMinutes,
    List<String> qualityGates,
    Map<String, Object> metadata,
    Instant createdAt
) implements Serializable {

    public WorkflowDefinition {
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("Workflow " + workflowId + " must have at least one phase");
        }
        if (estimatedDurationMinutes <= 0) {
            throw new IllegalArgumentException("Estimated duration must be positive: " + estimatedDurationMinutes);
        }
        phases = List.copyOf(phases);
        var ids = new HashSet<String>();
        for (WorkflowPhase phase : phases) {
            if (!ids.add(phase.phaseId())) {
                throw new IllegalArgumentException("Duplicate phase id in workflow " + workflowId + ": " + phase.phaseId());
            }
        }
        var deps = new LinkedHashMap<String, List<String>>();
        if (dependencies != null) {
            dependencies.forEach((k, v) -> deps.put(k, v == null ? List.of() : List.copyOf(v)));
        }
        dependencies = Collections.unmodifiableMap(deps);
        qualityGates = qualityGates == null ? List.of() : List.copyOf(qualityGates);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public Optional<WorkflowPhase> phase(String phaseId) {
        return phases.stream().filter(p -> p.phaseId().equals(phaseId)).findFirst();
    }

    public List<String> dependenciesOf(String phaseId) {
        return dependencies.getOrDefault(phaseId, List.of());
    }

    /** Distinct contexts used by the phases, in phase order. */
    public Set<String> contexts() {
        var contexts = new LinkedHashSet<String>();
        phases.forEach(p -> contexts.add(p.context()));
        return contexts;
    }

    public WorkflowDefinition withPhases(List<WorkflowPhase> newPhases, Map<String, List<String>> newDependencies,
                                         int newEstimatedDuration) {
        return new WorkflowDefinition(workflowId, name, description, newPhases, newDependencies,
                newEstimatedDuration, qualityGates, metadata, createdAt);
    }

    public WorkflowDefinition withMetadata(Map<String, Object> extra) {
        var merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new WorkflowDefinition(workflowId, name, description, phases, dependencies,
                estimatedDurationMinutes, qualityGates, merged, createdAt);
    }
}
