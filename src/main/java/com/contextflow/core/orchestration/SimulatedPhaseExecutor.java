package com.contextflow.core.orchestration;

import com.contextflow.core.context.ContextCatalog;
import com.contextflow.core.context.ContextProfile;
import com.contextflow.core.model.WorkflowPhase;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stand-in executor that produces every declared output of a phase without doing real work.
 * Used as the registry fallback so workflows run end to end before real executors are plugged in.
 */
public class SimulatedPhaseExecutor implements PhaseExecutor {

    public static final String ANY_CONTEXT = "*";

    private final ContextCatalog catalog;

    public SimulatedPhaseExecutor(ContextCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public String context() {
        return ANY_CONTEXT;
    }

    @Override
    public Map<String, Object> execute(WorkflowPhase phase, Map<String, Object> inputs, WorkflowState state) {
        var results = new LinkedHashMap<String, Object>();
        String function = catalog.profile(phase.context())
                .map(ContextProfile::primaryFunction)
                .orElse("general");
        for (String output : phase.outputs()) {
            results.put(output, output + " from " + phase.name());
        }
        results.put("status", "completed");
        results.put("context", phase.context());
        results.put("primary_function", function);
        results.put("inputs_received", inputs.size());
        results.put("quality_gates_passed", phase.qualityGates());
        return results;
    }
}
