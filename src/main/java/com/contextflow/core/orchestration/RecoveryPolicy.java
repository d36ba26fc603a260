package com.contextflow.core.orchestration;

import com.contextflow.config.ContextFlowProperties;
import com.contextflow.core.model.RecoveryAction;
import com.contextflow.core.model.WorkflowPhase;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Ordered list of {@link RecoveryStrategy} rules consulted top-down; the first match wins.
 * A failure no rule matches aborts the workflow.
 */
public class RecoveryPolicy {

    private final List<RecoveryStrategy> strategies;

    public RecoveryPolicy(List<RecoveryStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Default rules, in order: oscillating errors escalate, timeouts retry with backoff,
     * validation failures abort, critical errors abort, retryable errors retry.
     */
    public static RecoveryPolicy defaults(ContextFlowProperties.Orchestrator settings) {
        int maxRetries = settings.getTimeoutMaxRetries();
        double backoff = settings.getTimeoutBackoff();
        var strategies = new ArrayList<RecoveryStrategy>();
        strategies.add(RecoveryStrategy.of("oscillation_escalate",
                (phase, error, state) -> state.oscillationDetector().isOscillating(phase.phaseId()),
                () -> RecoveryAction.escalate("Phase alternates between distinct errors")));
        strategies.add(RecoveryStrategy.of("timeout_retry",
                (phase, error, state) -> error instanceof TimeoutException,
                () -> RecoveryAction.retry(maxRetries, backoff, "Retry on timeout with backoff")));
        strategies.add(RecoveryStrategy.of("validation_abort",
                (phase, error, state) -> error instanceof PhaseValidationException || messageContains(error, "validation"),
                () -> RecoveryAction.abort("Fail workflow on validation error")));
        strategies.add(RecoveryStrategy.of("critical_abort",
                (phase, error, state) -> messageContains(error, "critical"),
                () -> RecoveryAction.abort("Abort on critical error")));
        strategies.add(RecoveryStrategy.of("retryable_retry",
                (phase, error, state) -> error instanceof PhaseExecutionException pe && pe.isRetryable(),
                () -> RecoveryAction.retry(maxRetries, backoff, "Retry transient phase failure")));
        return new RecoveryPolicy(strategies);
    }

    /**
     * Chooses the recovery action for a failed phase.
     */
    public RecoveryAction evaluate(WorkflowPhase phase, Throwable error, WorkflowState state) {
        for (RecoveryStrategy strategy : strategies) {
            if (strategy.condition().matches(phase, error, state)) {
                return strategy.action().create(phase, error, state);
            }
        }
        return RecoveryAction.abort("No recovery strategy found for "
                + error.getClass().getSimpleName() + " in " + phase.context());
    }

    public List<RecoveryStrategy> strategies() {
        return strategies;
    }

    private static boolean messageContains(Throwable error, String fragment) {
        return error.getMessage() != null && error.getMessage().toLowerCase().contains(fragment);
    }
}
