package com.contextflow.core.composition;

import com.contextflow.core.model.WorkflowTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Source of pre-authored workflow templates consulted before synthesizing a workflow.
 */
public interface TemplateLibrary {

    List<WorkflowTemplate> templates();

    default Optional<WorkflowTemplate> find(String templateId) {
        return templates().stream().filter(t -> t.templateId().equals(templateId)).findFirst();
    }

    default boolean isEmpty() {
        return templates().isEmpty();
    }

    /** A library with no templates; composition always synthesizes. */
    static TemplateLibrary empty() {
        return List::of;
    }

    static TemplateLibrary of(List<WorkflowTemplate> templates) {
        List<WorkflowTemplate> copy = List.copyOf(templates);
        return () -> copy;
    }
}
