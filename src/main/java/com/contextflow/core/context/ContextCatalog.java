package com.contextflow.core.context;

import com.contextflow.core.model.ComplexityLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of {@link ContextProfile}s covering every {@link ContextType}.
 * Built once at start-up and shared read-only by the analyzer, composer and orchestrator.
 */
public final class ContextCatalog {

    private static final double COMPLEX_TIMEOUT_FACTOR = 1.5;
    private static final double SIMPLE_TIMEOUT_FACTOR = 0.7;

    private final Map<ContextType, ContextProfile> profiles;

    private ContextCatalog(Map<ContextType, ContextProfile> profiles) {
        for (ContextType type : ContextType.values()) {
            if (!profiles.containsKey(type)) {
                throw new IllegalArgumentException("Context catalog is missing a profile for " + type.id());
            }
        }
        this.profiles = Collections.unmodifiableMap(new EnumMap<>(profiles));
    }

    /** The default catalog. */
    public static ContextCatalog defaults() {
        return withTimeoutOverrides(Map.of());
    }

    /**
     * The default catalog with base timeouts replaced for the given context ids.
     * Unknown ids and non-positive values are ignored.
     */
    public static ContextCatalog withTimeoutOverrides(Map<String, Integer> overrides) {
        var map = new EnumMap<ContextType, ContextProfile>(ContextType.class);
        for (ContextProfile profile : defaultProfiles()) {
            map.put(profile.context(), profile);
        }
        if (overrides != null) {
            overrides.forEach((id, seconds) -> ContextType.fromId(id).ifPresent(type -> {
                if (seconds != null && seconds > 0) {
                    map.put(type, map.get(type).withBaseTimeout(seconds));
                }
            }));
        }
        return new ContextCatalog(map);
    }

    public ContextProfile profile(ContextType type) {
        return profiles.get(type);
    }

    public Optional<ContextProfile> profile(String contextId) {
        return ContextType.fromId(contextId).map(profiles::get);
    }

    public boolean isParallelSafe(String contextId) {
        return profile(contextId).map(ContextProfile::parallelSafe).orElse(false);
    }

    /** Logical order index; unknown contexts sort last. */
    public int order(String contextId) {
        return profile(contextId).map(ContextProfile::order).orElse(Integer.MAX_VALUE);
    }

    public Comparator<String> logicalOrder() {
        return Comparator.comparingInt(this::order);
    }

    /**
     * Phase timeout for a context after complexity scaling.
     */
    public int timeoutFor(String contextId, ComplexityLevel complexity) {
        int base = profile(contextId).map(ContextProfile::baseTimeoutSeconds).orElse(600);
        if (complexity == ComplexityLevel.COMPLEX) {
            return (int) (base * COMPLEX_TIMEOUT_FACTOR);
        }
        if (complexity == ComplexityLevel.SIMPLE) {
            return (int) (base * SIMPLE_TIMEOUT_FACTOR);
        }
        return base;
    }

    /**
     * Direct predecessor contexts of the given context.
     */
    public Set<ContextType> predecessors(String contextId) {
        return profile(contextId).map(ContextProfile::predecessors).orElse(Set.of());
    }

    /**
     * Nearest predecessor contexts that are present in {@code available}: direct predecessors
     * when present, otherwise the walk continues up the predecessor chain.
     */
    public Set<ContextType> nearestPresentPredecessors(String contextId, Set<ContextType> available) {
        var result = new LinkedHashSet<ContextType>();
        var visited = new LinkedHashSet<ContextType>();
        var frontier = new ArrayList<>(predecessors(contextId));
        while (!frontier.isEmpty()) {
            ContextType next = frontier.remove(0);
            if (!visited.add(next)) {
                continue;
            }
            if (available.contains(next)) {
                result.add(next);
            } else {
                frontier.addAll(profiles.get(next).predecessors());
            }
        }
        return result;
    }

    public List<ContextProfile> all() {
        return profiles.values().stream()
                .sorted(Comparator.comparingInt(ContextProfile::order))
                .toList();
    }

    private static List<ContextProfile> defaultProfiles() {
        return List.of(
                new ContextProfile(ContextType.REQUIREMENTS_ANALYSIS, "requirements_analysis",
                        "Requirements Analysis", "Analyze requirements and create user stories",
                        List.of("task_description", "project_context"),
                        List.of("user_stories", "acceptance_criteria"),
                        List.of("requirements_completeness", "acceptance_criteria_clarity"),
                        300, Set.of(), false, 0),
                new ContextProfile(ContextType.DESIGN, "architecture_design",
                        "Architecture Design", "Create system architecture and design specifications",
                        List.of("requirements", "existing_architecture"),
                        List.of("design_specifications", "architecture_diagrams"),
                        List.of("design_completeness", "architecture_consistency"),
                        600, Set.of(ContextType.REQUIREMENTS_ANALYSIS), false, 1),
                new ContextProfile(ContextType.IMPLEMENTATION, "implementation",
                        "Implementation", "Implement the required functionality",
                        List.of("design_specifications", "coding_standards"),
                        List.of("source_code", "implementation_notes"),
                        List.of("code_quality", "coding_standards_compliance"),
                        1800, Set.of(ContextType.DESIGN), false, 2),
                new ContextProfile(ContextType.VERIFICATION, "quality_assurance",
                        "Testing", "Create and execute comprehensive tests",
                        List.of("source_code", "test_requirements"),
                        List.of("test_suite", "test_results", "coverage_report"),
                        List.of("test_coverage", "test_quality"),
                        900, Set.of(ContextType.IMPLEMENTATION), true, 3),
                new ContextProfile(ContextType.DEBUGGING, "issue_resolution",
                        "Issue Resolution", "Debug and resolve identified issues",
                        List.of("error_reports", "system_logs"),
                        List.of("root_cause_analysis", "fixes"),
                        List.of("issue_resolution", "no_regressions"),
                        1200, Set.of(ContextType.VERIFICATION), false, 4),
                new ContextProfile(ContextType.DOCUMENTATION, "documentation",
                        "Documentation", "Create and update documentation",
                        List.of("implementation_details", "api_specifications"),
                        List.of("documentation", "user_guides"),
                        List.of("documentation_completeness", "clarity"),
                        600, Set.of(ContextType.IMPLEMENTATION), true, 5),
                new ContextProfile(ContextType.SECURITY_REVIEW, "security_analysis",
                        "Security Review", "Perform security analysis and vulnerability assessment",
                        List.of("source_code", "security_requirements"),
                        List.of("security_analysis", "vulnerability_report"),
                        List.of("security_compliance", "vulnerability_assessment"),
                        900, Set.of(ContextType.IMPLEMENTATION), true, 6),
                new ContextProfile(ContextType.OPTIMIZATION, "performance_optimization",
                        "Performance Optimization", "Optimize performance and efficiency",
                        List.of("performance_requirements", "benchmark_data"),
                        List.of("optimized_code", "performance_report"),
                        List.of("performance_targets", "efficiency_metrics"),
                        1200, Set.of(ContextType.VERIFICATION), false, 7),
                new ContextProfile(ContextType.RESEARCH, "research",
                        "Research", "Gather background information and prior art",
                        List.of("task_description"),
                        List.of("research_findings"),
                        List.of("basic_validation"),
                        600, Set.of(), false, 8),
                new ContextProfile(ContextType.GENERAL, "general",
                        "General Execution", "Execute general-purpose work",
                        List.of("previous_outputs"),
                        List.of("phase_results"),
                        List.of("basic_validation"),
                        600, Set.of(), false, 9),
                new ContextProfile(ContextType.RELEASE, "deployment",
                        "Deployment", "Commit, test, and deploy changes",
                        List.of("finalized_code", "test_results"),
                        List.of("commit_hash", "deployment_status"),
                        List.of("deployment_success", "no_breaking_changes"),
                        300, Set.of(ContextType.VERIFICATION), false, 10)
        );
    }
}
