package com.contextflow.core.composition;

import com.contextflow.core.model.ComplexityLevel;
import com.contextflow.core.model.Entity;
import com.contextflow.core.model.TaskAnalysis;
import com.contextflow.core.model.WorkflowPhase;
import com.contextflow.core.model.WorkflowTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.contextflow.core.composition.WorkflowValidatorTest.phase;
import static org.junit.jupiter.api.Assertions.*;

class TemplateMatcherTest {

    private final TemplateMatcher matcher = new TemplateMatcher(0.6);

    private static WorkflowTemplate template(String id, String category, double successRate, String... contexts) {
        var phases = new ArrayList<WorkflowPhase>();
        for (int i = 0; i < contexts.length; i++) {
            phases.add(phase(id + "_" + i, contexts[i]));
        }
        return new WorkflowTemplate(id, id, "", category, phases, Map.of(), List.of(), 0, successRate, null);
    }

    private static TaskAnalysis analysis(ComplexityLevel complexity, List<String> contexts, String... entityTypes) {
        var entities = Arrays.stream(entityTypes)
                .map(type -> new Entity("thing", type, 0.7, Map.of()))
                .toList();
        return new TaskAnalysis("task_t", "t", entities, complexity, contexts, 30, List.of(), List.of(), 0.5, null);
    }

    @Test
    @DisplayName("Score adds overlap, category, complexity fit and success bonus")
    void fullScore() {
        var bugFix = template("bug-fix", "bug_fix", 0.9, "debugging", "implementation", "verification");
        var task = analysis(ComplexityLevel.SIMPLE, List.of("debugging", "implementation", "verification"), "bug");

        assertEquals(1.0, matcher.score(bugFix, task), 1e-9);
    }

    @Test
    @DisplayName("Partial overlap scales the overlap component")
    void partialOverlap() {
        var template = template("t", "general", 0.5, "implementation");
        var task = analysis(ComplexityLevel.MEDIUM, List.of("implementation", "verification"));

        assertEquals(0.2, matcher.score(template, task), 1e-9);
    }

    @Test
    @DisplayName("Templates below the threshold are not selected")
    void belowThreshold() {
        var library = TemplateLibrary.of(List.of(template("t", "general", 0.5, "documentation")));
        assertTrue(matcher.select(library, analysis(ComplexityLevel.MEDIUM, List.of("implementation"))).isEmpty());
        assertTrue(matcher.select(TemplateLibrary.empty(), analysis(ComplexityLevel.MEDIUM, List.of())).isEmpty());
    }

    @Test
    @DisplayName("Best scoring template wins")
    void bestWins() {
        var weaker = template("weaker", "general", 0.5, "debugging", "implementation", "verification");
        var stronger = template("stronger", "bug_fix", 0.9, "debugging", "implementation", "verification");
        var task = analysis(ComplexityLevel.SIMPLE, List.of("debugging", "implementation", "verification"), "bug");

        var match = matcher.select(TemplateLibrary.of(List.of(weaker, stronger)), task).orElseThrow();
        assertEquals("stronger", match.template().templateId());
    }

    @Test
    @DisplayName("Complexity fit bands")
    void complexityFit() {
        assertTrue(TemplateMatcher.fitsComplexity(3, ComplexityLevel.SIMPLE));
        assertFalse(TemplateMatcher.fitsComplexity(4, ComplexityLevel.SIMPLE));
        assertTrue(TemplateMatcher.fitsComplexity(6, ComplexityLevel.MEDIUM));
        assertFalse(TemplateMatcher.fitsComplexity(2, ComplexityLevel.MEDIUM));
        assertTrue(TemplateMatcher.fitsComplexity(5, ComplexityLevel.COMPLEX));
        assertFalse(TemplateMatcher.fitsComplexity(4, ComplexityLevel.COMPLEX));
    }
}
