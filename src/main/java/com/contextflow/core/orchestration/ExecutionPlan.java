package com.contextflow.core.orchestration;

import com.contextflow.core.model.WorkflowPhase;

import java.util.List;

/**
 * Fixed, ordered list of steps computed once before execution starts.
 *
 * @param workflowId the planned workflow
 * @param steps      steps in execution order
 */
public record ExecutionPlan(String workflowId, List<Step> steps) {

    public ExecutionPlan {
        steps = List.copyOf(steps);
    }

    /**
     * One step: a single phase, or a parallel group whose members run concurrently.
     *
     * @param parallelGroup group name, null for a single phase
     * @param phases        the phases of this step, never empty
     */
    public record Step(String parallelGroup, List<WorkflowPhase> phases) {

        public Step {
            phases = List.copyOf(phases);
        }

        public static Step single(WorkflowPhase phase) {
            return new Step(null, List.of(phase));
        }

        public boolean isParallel() {
            return phases.size() > 1;
        }
    }

    public int phaseCount() {
        return steps.stream().mapToInt(s -> s.phases().size()).sum();
    }
}
