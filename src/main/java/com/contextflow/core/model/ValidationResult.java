package com.contextflow.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating a workflow definition or a propagated result bag.
 *
 * @param passed   true when the score reaches {@link #PASS_THRESHOLD}
 * @param score    score in [0, 1]; 1.0 means no violations
 * @param messages one message per violation
 * @param details  extra diagnostic data
 */
public record ValidationResult(
    boolean passed,
    double score,
    List<String> messages,
    Map<String, Object> details
) implements Serializable {

    public static final double PASS_THRESHOLD = 0.7;

    public ValidationResult {
        score = Math.max(0.0, Math.min(1.0, score));
        messages = messages == null ? List.of() : List.copyOf(messages);
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ValidationResult of(double score, List<String> messages, Map<String, Object> details) {
        return new ValidationResult(score >= PASS_THRESHOLD, score, messages, details);
    }

    public boolean hasMessageContaining(String fragment) {
        return messages.stream().anyMatch(m -> m.toLowerCase().contains(fragment.toLowerCase()));
    }
}
