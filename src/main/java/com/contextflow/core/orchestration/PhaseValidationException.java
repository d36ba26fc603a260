package com.contextflow.core.orchestration;

import java.util.List;

/**
 * A phase returned results that break its output contract (missing declared outputs,
 * or an {@code error}/{@code errors} entry), or was bound to an unknown context.
 */
public class PhaseValidationException extends PhaseExecutionException {

    private final List<String> violations;

    public PhaseValidationException(String phaseId, String context, List<String> violations) {
        super(phaseId, context, "Phase validation failed for " + phaseId + ": " + violations);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
