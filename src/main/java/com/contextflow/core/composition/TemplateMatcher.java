package com.contextflow.core.composition;

import com.contextflow.core.context.ContextType;
import com.contextflow.core.model.ComplexityLevel;
import com.contextflow.core.model.Entity;
import com.contextflow.core.model.TaskAnalysis;
import com.contextflow.core.model.WorkflowPhase;
import com.contextflow.core.model.WorkflowTemplate;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores templates against a task analysis and picks the best one above the acceptance threshold.
 * <p>
 * Score components: context overlap (0.4), category match on entity types (0.3),
 * phase count fit for the complexity (0.2), success rate above 0.8 (0.1).
 */
public class TemplateMatcher {

    /**
     * A template accepted for a task, with its match score.
     */
    public record Match(WorkflowTemplate template, double score) {}

    private static final Map<String, Set<String>> CATEGORY_ENTITY_TYPES = Map.of(
            "feature_development", Set.of("feature", "component", "api", "ui"),
            "bug_fix", Set.of("bug", "issue", "error"),
            "security_audit", Set.of("security", "vulnerability"),
            "performance_optimization", Set.of("performance", "optimization"),
            "code_review", Set.of("review", "quality"),
            "documentation", Set.of("documentation", "guide", "manual")
    );

    private final double threshold;

    public TemplateMatcher(double threshold) {
        this.threshold = threshold;
    }

    public Optional<Match> select(TemplateLibrary library, TaskAnalysis analysis) {
        Match best = null;
        for (WorkflowTemplate template : library.templates()) {
            double score = score(template, analysis);
            // strictly greater keeps the first template on ties
            if (score >= threshold && (best == null || score > best.score())) {
                best = new Match(template, score);
            }
        }
        return Optional.ofNullable(best);
    }

    public double score(WorkflowTemplate template, TaskAnalysis analysis) {
        double score = 0.0;

        Set<String> templateContexts = template.phases().stream()
                .map(WorkflowPhase::context)
                .map(ContextType::canonical)
                .collect(Collectors.toSet());
        Set<String> required = analysis.requiredContexts().stream()
                .map(ContextType::canonical)
                .collect(Collectors.toSet());
        if (!required.isEmpty()) {
            var overlap = new HashSet<>(templateContexts);
            overlap.retainAll(required);
            score += (double) overlap.size() / required.size() * 0.4;
        }

        Set<String> entityTypes = analysis.entities().stream().map(Entity::type).collect(Collectors.toSet());
        Set<String> categoryTypes = CATEGORY_ENTITY_TYPES.get(template.category());
        if (categoryTypes != null && categoryTypes.stream().anyMatch(entityTypes::contains)) {
            score += 0.3;
        }

        if (fitsComplexity(template.phases().size(), analysis.complexity())) {
            score += 0.2;
        }

        if (template.successRate() > 0.8) {
            score += 0.1;
        }
        return Math.min(1.0, score);
    }

    static boolean fitsComplexity(int phaseCount, ComplexityLevel complexity) {
        return switch (complexity) {
            case SIMPLE -> phaseCount <= 3;
            case MEDIUM -> phaseCount >= 3 && phaseCount <= 6;
            case COMPLEX -> phaseCount >= 5;
        };
    }
}
