package com.contextflow.core.orchestration;

/**
 * Optional collaborator notified whenever execution moves from one context to another.
 */
@FunctionalInterface
public interface ContextSwitcher {

    /**
     * @param fromContext the outgoing context, null for the first phase
     * @param toContext   the incoming context
     * @param state       the workflow state
     */
    void switchContext(String fromContext, String toContext, WorkflowState state);
}
