package com.contextflow.core.orchestration;

import com.contextflow.core.model.WorkflowDefinition;
import com.contextflow.core.model.WorkflowPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Partitions a workflow into sequential steps and parallel groups.
 * <p>
 * A group is emitted at the position of its first member. Members whose dependencies are not
 * satisfied by earlier steps are left out of the group and emitted when the walk reaches them.
 * No re-planning happens once execution starts.
 */
public class ExecutionPlanner {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPlanner.class);

    public ExecutionPlan plan(WorkflowDefinition workflow) {
        Set<String> phaseIds = new HashSet<>();
        workflow.phases().forEach(p -> phaseIds.add(p.phaseId()));

        var steps = new ArrayList<ExecutionPlan.Step>();
        var emitted = new HashSet<String>();

        for (WorkflowPhase phase : workflow.phases()) {
            if (emitted.contains(phase.phaseId())) {
                continue;
            }
            if (!phase.isParallel()) {
                steps.add(ExecutionPlan.Step.single(phase));
                emitted.add(phase.phaseId());
                continue;
            }

            var ready = new ArrayList<WorkflowPhase>();
            for (WorkflowPhase member : workflow.phases()) {
                if (emitted.contains(member.phaseId()) || !phase.parallelGroup().equals(member.parallelGroup())) {
                    continue;
                }
                if (dependenciesSatisfied(workflow, member, emitted, phaseIds)) {
                    ready.add(member);
                } else if (member != phase) {
                    log.debug("Deferring {} out of {}: dependencies not yet satisfied",
                            member.phaseId(), phase.parallelGroup());
                }
            }
            if (ready.size() > 1 && ready.contains(phase)) {
                steps.add(new ExecutionPlan.Step(phase.parallelGroup(), ready));
                ready.forEach(p -> emitted.add(p.phaseId()));
            } else {
                steps.add(ExecutionPlan.Step.single(phase));
                emitted.add(phase.phaseId());
            }
        }

        log.debug("Execution plan for {}: {} steps for {} phases", workflow.workflowId(), steps.size(),
                workflow.phases().size());
        return new ExecutionPlan(workflow.workflowId(), steps);
    }

    private static boolean dependenciesSatisfied(WorkflowDefinition workflow, WorkflowPhase phase,
                                                 Set<String> emitted, Set<String> phaseIds) {
        List<String> deps = workflow.dependenciesOf(phase.phaseId());
        return deps.stream().filter(phaseIds::contains).allMatch(emitted::contains);
    }
}
