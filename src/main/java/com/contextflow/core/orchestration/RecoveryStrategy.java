package com.contextflow.core.orchestration;

import com.contextflow.core.model.RecoveryAction;
import com.contextflow.core.model.WorkflowPhase;

import java.util.function.Supplier;

/**
 * A named rule in the recovery policy: when {@code condition} holds for a failure,
 * {@code action} decides what to do.
 *
 * @param name      strategy name, recorded with the chosen action
 * @param condition predicate over the failed phase, the error and the workflow state
 * @param action    produces the recovery action for a matching failure
 */
public record RecoveryStrategy(String name, Condition condition, ActionFactory action) {

    @FunctionalInterface
    public interface Condition {
        boolean matches(WorkflowPhase phase, Throwable error, WorkflowState state);
    }

    @FunctionalInterface
    public interface ActionFactory {
        RecoveryAction create(WorkflowPhase phase, Throwable error, WorkflowState state);
    }

    public static RecoveryStrategy of(String name, Condition condition, Supplier<RecoveryAction> action) {
        return new RecoveryStrategy(name, condition, (phase, error, state) -> action.get());
    }
}
