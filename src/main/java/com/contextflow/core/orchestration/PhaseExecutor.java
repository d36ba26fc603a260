package com.contextflow.core.orchestration;

import com.contextflow.core.model.WorkflowPhase;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Performs the business work of a phase for one context.
 * Implementations: {@link SimulatedPhaseExecutor} (stand-in outputs), or anything registered
 * in the {@link PhaseExecutorRegistry}.
 */
public interface PhaseExecutor {

    /**
     * Context id this executor handles (e.g. "implementation").
     */
    String context();

    /**
     * Runs the phase and returns its result bag. Should respond to interruption,
     * which is how the orchestrator cancels a phase that exceeds its timeout.
     *
     * @param phase  the phase being executed
     * @param inputs prepared inputs (context data, {@code previous_<phaseId>} bags, declared inputs)
     * @param state  the owning workflow state, read-only by convention
     * @return results keyed by output name
     */
    Map<String, Object> execute(WorkflowPhase phase, Map<String, Object> inputs, WorkflowState state);

    /**
     * Asynchronous variant. The default runs {@link #execute} on the given pool and interrupts
     * it when the returned future is cancelled. Executors backed by an async API override this.
     */
    default CompletableFuture<Map<String, Object>> executeAsync(WorkflowPhase phase, Map<String, Object> inputs,
                                                                WorkflowState state, ExecutorService pool) {
        var result = new CompletableFuture<Map<String, Object>>();
        Future<?> task = pool.submit(() -> {
            try {
                result.complete(execute(phase, inputs, state));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }
}
