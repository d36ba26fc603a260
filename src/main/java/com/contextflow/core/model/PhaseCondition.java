package com.contextflow.core.model;

import java.util.Map;

/**
 * Optional guard evaluated against a phase's prepared inputs right before it runs.
 * A phase whose condition returns false is skipped.
 */
@FunctionalInterface
public interface PhaseCondition {

    boolean test(Map<String, Object> inputs);

    /**
     * Condition that holds when the given input key is present and not {@code Boolean.FALSE}.
     */
    static PhaseCondition inputPresent(String key) {
        return inputs -> inputs.containsKey(key) && !Boolean.FALSE.equals(inputs.get(key));
    }
}
