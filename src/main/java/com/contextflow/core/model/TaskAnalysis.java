package com.contextflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Structured intent extracted from a free-text task description.
 * Created once by the analyzer and never mutated.
 *
 * @param taskId                   unique identifier (e.g. "task_20260101_120000_ab12cd34_ef56ab78")
 * @param description              the original description
 * @param entities                 extracted entities, highest confidence first
 * @param complexity               assessed complexity
 * @param requiredContexts         ordered, duplicate-free context ids
 * @param estimatedDurationMinutes estimated effort, always positive
 * @param dependencies             external prerequisites named in the text
 * @param successCriteria          acceptance criteria derived from entity types
 * @param confidence               overall confidence in [0, 1]
 * @param createdAt                analysis timestamp
 */
public record TaskAnalysis(
    String taskId,
    String description,
    List<Entity> entities,
    ComplexityLevel complexity,
    List<String> requiredContexts,
    int estimatedDurationMinutes,
    List<String> dependencies,
    List<String> successCriteria,
    double confidence,
    Instant createdAt
) implements Serializable {

    public TaskAnalysis {
        if (estimatedDurationMinutes <= 0) {
            throw new IllegalArgumentException("Estimated duration must be positive: " + estimatedDurationMinutes);
        }
        description = description == null ? "" : description;
        entities = entities == null ? List.of() : List.copyOf(entities);
        requiredContexts = requiredContexts == null ? List.of() : List.copyOf(requiredContexts);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public boolean hasEntityType(String type) {
        return entities.stream().anyMatch(e -> e.type().equals(type));
    }
}
