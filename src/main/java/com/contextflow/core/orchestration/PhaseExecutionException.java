package com.contextflow.core.orchestration;

/**
 * Failure raised while executing a single workflow phase.
 * <p>
 * Retryable failures are eligible for the default retry strategy; all others go straight
 * to the abort, skip or escalate strategies.
 */
public class PhaseExecutionException extends RuntimeException {

    private final String phaseId;
    private final String context;
    private final boolean retryable;

    public PhaseExecutionException(String phaseId, String context, String message) {
        this(phaseId, context, message, false, null);
    }

    public PhaseExecutionException(String phaseId, String context, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.phaseId = phaseId;
        this.context = context;
        this.retryable = retryable;
    }

    public String getPhaseId() {
        return phaseId;
    }

    public String getContext() {
        return context;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
