package com.contextflow.core.events;

import java.util.Objects;
import java.util.Set;

/**
 * Selects the events a subscriber receives. Filters compose with {@link #and}.
 */
@FunctionalInterface
public interface EventFilter {

    boolean accepts(WorkflowEvent event);

    default EventFilter and(EventFilter other) {
        return event -> accepts(event) && other.accepts(event);
    }

    static EventFilter all() {
        return event -> true;
    }

    static EventFilter workflow(String workflowId) {
        return event -> Objects.equals(workflowId, event.workflowId());
    }

    static EventFilter phase(String phaseId) {
        return event -> Objects.equals(phaseId, event.phaseId());
    }

    static EventFilter types(String... eventTypes) {
        Set<String> accepted = Set.of(eventTypes);
        return event -> accepted.contains(event.eventType());
    }

    /** Events whose type starts with {@code category + "."}, e.g. every "phase.*" event. */
    static EventFilter category(String category) {
        return event -> category.equals(event.category());
    }
}
