package com.contextflow.core.orchestration;

import java.util.Map;

/**
 * Optional collaborator supplying context-specific policy data during a context transition.
 * The data is stored in the workflow context under {@code <context>_rules}.
 */
@FunctionalInterface
public interface ContextPolicyLoader {

    Map<String, Object> loadPolicy(String context);
}
