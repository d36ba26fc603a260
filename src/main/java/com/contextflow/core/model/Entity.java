package com.contextflow.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * A candidate concept found in a task description.
 *
 * @param name       the matched phrase, trimmed
 * @param type       entity type (feature, bug, component, api, database, ui, security, performance, prerequisite)
 * @param confidence extraction confidence in [0, 1]
 * @param attributes extra data such as match position and length
 */
public record Entity(
    String name,
    String type,
    double confidence,
    Map<String, Object> attributes
) implements Serializable {

    public Entity {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name must not be blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Entity type must not be blank");
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
