package com.contextflow.core.model;

/**
 * Status of an individual phase within a workflow execution.
 * <p>
 * PENDING -> RUNNING -> {COMPLETED | FAILED | SKIPPED}
 */
public enum PhaseStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
