package com.contextflow.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reusable, pre-authored skeleton of phases matched against a task analysis.
 *
 * @param templateId             unique identifier
 * @param name                   display name
 * @param description            what the template is for
 * @param category               category used for entity matching (e.g. "feature_development", "bug_fix")
 * @param phases                 template phases; ids are local to the template
 * @param parameters             free-form parameters (e.g. "optional_contexts")
 * @param tags                   search tags
 * @param usageCount             number of times the template has been used
 * @param successRate            historical success rate in [0, 1]
 * @param averageDurationMinutes historical average duration, null when unknown
 */
public record WorkflowTemplate(
    String templateId,
    String name,
    String description,
    String category,
    List<WorkflowPhase> phases,
    Map<String, Object> parameters,
    List<String> tags,
    int usageCount,
    double successRate,
    Integer averageDurationMinutes
) implements Serializable {

    public WorkflowTemplate {
        phases = phases == null ? List.of() : List.copyOf(phases);
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        tags = tags == null ? List.of() : List.copyOf(tags);
        category = category == null ? "general" : category;
        successRate = Math.max(0.0, Math.min(1.0, successRate));
    }
}
