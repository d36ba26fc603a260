package com.contextflow.core.composition;

import com.contextflow.core.context.ContextCatalog;
import com.contextflow.core.context.ContextType;
import com.contextflow.core.model.ValidationResult;
import com.contextflow.core.model.WorkflowDefinition;
import com.contextflow.core.model.WorkflowPhase;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores a workflow definition for structural soundness. The score starts at 1.0 and each
 * violation class deducts a fixed amount; the workflow passes at {@link ValidationResult#PASS_THRESHOLD}.
 */
public class WorkflowValidator {

    static final double INVALID_CONTEXT_PENALTY = 0.2;
    static final double MISSING_RELEASE_PENALTY = 0.1;
    static final double MISSING_VERIFICATION_PENALTY = 0.1;
    static final double UNKNOWN_DEPENDENCY_PENALTY = 0.2;
    static final double MISSING_EDGE_PENALTY = 0.1;
    static final double DISCONNECTED_PENALTY = 0.3;
    static final double CYCLE_PENALTY = 0.4;

    private final ContextCatalog catalog;

    public WorkflowValidator(ContextCatalog catalog) {
        this.catalog = catalog;
    }

    public ValidationResult validate(WorkflowDefinition workflow) {
        var messages = new ArrayList<String>();
        var details = new LinkedHashMap<String, Object>();
        details.put("validation_type", "workflow_definition");
        details.put("workflow_id", workflow.workflowId());

        double score = 1.0;

        for (WorkflowPhase phase : workflow.phases()) {
            if (!ContextType.isKnown(phase.context())) {
                messages.add("Invalid context in phase " + phase.phaseId() + ": " + phase.context());
                score -= INVALID_CONTEXT_PENALTY;
            }
        }

        Set<String> contexts = workflow.phases().stream()
                .map(p -> ContextType.canonical(p.context()))
                .collect(Collectors.toSet());
        if (contexts.size() > 1 && !contexts.contains(ContextType.RELEASE.id())) {
            messages.add("Workflow missing release phase");
            score -= MISSING_RELEASE_PENALTY;
        }
        if (workflow.phases().size() > 2 && !contexts.contains(ContextType.VERIFICATION.id())) {
            messages.add("Workflow with more than two phases missing verification phase");
            score -= MISSING_VERIFICATION_PENALTY;
        }

        DependencyGraph graph = graphOf(workflow);

        Map<String, List<String>> unknown = graph.unknownReferences();
        if (!unknown.isEmpty()) {
            messages.add("Dependencies reference unknown phases: " + unknown);
            details.put("unknown_dependencies", unknown);
            score -= UNKNOWN_DEPENDENCY_PENALTY;
        }

        List<DependencyGraph.Edge> missingEdges = missingPredecessorEdges(workflow, graph);
        if (!missingEdges.isEmpty()) {
            missingEdges.forEach(e -> messages.add(
                    "Missing predecessor edge: " + e.dependency() + " -> " + e.dependent()));
            details.put("missing_edges", missingEdges.size());
            score -= MISSING_EDGE_PENALTY;
        }

        if (!graph.isConnected()) {
            messages.add("Workflow phases are not connected");
            score -= DISCONNECTED_PENALTY;
        }

        List<DependencyGraph.Edge> backEdges = graph.backEdges();
        if (!backEdges.isEmpty()) {
            messages.add("Circular dependencies detected: " + backEdges.stream()
                    .map(e -> e.dependent() + " -> " + e.dependency())
                    .collect(Collectors.joining(", ")));
            score -= CYCLE_PENALTY;
        }

        return ValidationResult.of(Math.max(0.0, score), messages, details);
    }

    /**
     * Pairs of phases whose contexts are linked in the predecessor table but where the
     * later phase does not (even transitively) depend on the earlier one.
     */
    List<DependencyGraph.Edge> missingPredecessorEdges(WorkflowDefinition workflow, DependencyGraph graph) {
        var missing = new ArrayList<DependencyGraph.Edge>();
        for (WorkflowPhase phase : workflow.phases()) {
            Set<ContextType> predecessors = catalog.predecessors(phase.context());
            if (predecessors.isEmpty()) {
                continue;
            }
            for (WorkflowPhase candidate : workflow.phases()) {
                boolean linked = ContextType.fromId(candidate.context())
                        .map(predecessors::contains)
                        .orElse(false);
                if (linked && !graph.dependsOn(phase.phaseId(), candidate.phaseId())) {
                    missing.add(new DependencyGraph.Edge(phase.phaseId(), candidate.phaseId()));
                }
            }
        }
        return missing;
    }

    static DependencyGraph graphOf(WorkflowDefinition workflow) {
        return new DependencyGraph(
                workflow.phases().stream().map(WorkflowPhase::phaseId).toList(),
                workflow.dependencies());
    }
}
