package com.contextflow.core.composition;

import com.contextflow.config.ContextFlowProperties;
import com.contextflow.core.context.ContextCatalog;
import com.contextflow.core.context.ContextProfile;
import com.contextflow.core.context.ContextType;
import com.contextflow.core.model.ComplexityLevel;
import com.contextflow.core.model.TaskAnalysis;
import com.contextflow.core.model.ValidationResult;
import com.contextflow.core.model.WorkflowDefinition;
import com.contextflow.core.model.WorkflowPhase;
import com.contextflow.core.model.WorkflowTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a validated {@link WorkflowDefinition} from a {@link TaskAnalysis}.
 * <p>
 * A matching template is customized when one scores above the threshold; otherwise a workflow
 * is synthesized from the required contexts. The result is optimized, validated, repaired once
 * when validation fails and re-validated. Composition never throws: the final validation outcome
 * travels in the workflow metadata and the caller decides whether to execute.
 */
@Service
public class WorkflowComposer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowComposer.class);

    public static final String META_TASK_ID = "task_id";
    public static final String META_COMPLEXITY = "complexity";
    public static final String META_TEMPLATE_USED = "template_used";
    public static final String META_TEMPLATE_SCORE = "template_score";
    public static final String META_VALIDATION_PASSED = "validation_passed";
    public static final String META_VALIDATION_SCORE = "validation_score";
    public static final String META_VALIDATION_MESSAGES = "validation_messages";
    public static final String META_REPAIRS_APPLIED = "repairs_applied";

    private final ContextCatalog catalog;
    private final TemplateLibrary templates;
    private final TemplateMatcher matcher;
    private final WorkflowValidator validator;
    private final int defaultRetryCount;

    public WorkflowComposer(ContextCatalog catalog, TemplateLibrary templates, ContextFlowProperties properties) {
        this.catalog = catalog;
        this.templates = templates;
        this.matcher = new TemplateMatcher(properties.getComposer().getTemplateThreshold());
        this.validator = new WorkflowValidator(catalog);
        this.defaultRetryCount = properties.getComposer().getDefaultRetryCount();
    }

    public WorkflowDefinition compose(TaskAnalysis analysis) {
        String workflowId = "workflow_" + analysis.taskId();
        log.info("Composing workflow for task {}", analysis.taskId());

        WorkflowDefinition workflow;
        try {
            Optional<TemplateMatcher.Match> match = matcher.select(templates, analysis);
            if (match.isPresent()) {
                log.info("Using template '{}' (score {})", match.get().template().name(),
                        String.format("%.2f", match.get().score()));
                workflow = customize(match.get(), analysis, workflowId);
            } else {
                log.info("No template above threshold, synthesizing workflow from {}", analysis.requiredContexts());
                workflow = synthesize(analysis, workflowId);
            }
            workflow = validateAndRepair(optimize(workflow));
        } catch (RuntimeException e) {
            log.error("Composition failed for task {}, falling back to a single implementation phase: {}",
                    analysis.taskId(), e.getMessage(), e);
            workflow = validateAndRepair(fallback(analysis, workflowId, e));
        }
        log.info("Workflow {} composed: {} phases, {} min estimated, validation score {}",
                workflow.workflowId(), workflow.phases().size(), workflow.estimatedDurationMinutes(),
                workflow.metadata().get(META_VALIDATION_SCORE));
        return workflow;
    }

    /**
     * Validates the workflow, repairs it once when validation fails and attaches the final
     * validation outcome to the metadata.
     */
    public WorkflowDefinition validateAndRepair(WorkflowDefinition workflow) {
        ValidationResult validation = validate(workflow);
        List<String> repairs = List.of();
        if (!validation.passed()) {
            log.warn("Workflow {} failed validation (score {}): {}", workflow.workflowId(),
                    String.format("%.2f", validation.score()), validation.messages());
            workflow = repair(workflow, validation);
            repairs = repairsOf(workflow);
            validation = validate(workflow);
            if (!validation.passed()) {
                log.warn("Workflow {} still invalid after repair: {}", workflow.workflowId(), validation.messages());
            }
        }
        var outcome = new LinkedHashMap<String, Object>();
        outcome.put(META_VALIDATION_PASSED, validation.passed());
        outcome.put(META_VALIDATION_SCORE, validation.score());
        outcome.put(META_VALIDATION_MESSAGES, validation.messages());
        outcome.put(META_REPAIRS_APPLIED, repairs);
        return workflow.withMetadata(outcome);
    }

    public ValidationResult validate(WorkflowDefinition workflow) {
        return validator.validate(workflow);
    }

    /**
     * Reorders phases by the ordering rules, tags parallel groups and applies a stable
     * topological sort. Returns a new definition with a recomputed duration estimate.
     */
    public WorkflowDefinition optimize(WorkflowDefinition workflow) {
        List<WorkflowPhase> phases = applyOrderingRules(workflow.phases());
        Map<String, List<String>> dependencies = workflow.dependencies();

        phases = assignParallelGroups(phases, dependencies);

        var graph = new DependencyGraph(phases.stream().map(WorkflowPhase::phaseId).toList(), dependencies);
        Map<String, WorkflowPhase> byId = phases.stream()
                .collect(Collectors.toMap(WorkflowPhase::phaseId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        List<WorkflowPhase> sorted = graph.topologicalOrder().stream().map(byId::get).toList();

        return workflow.withPhases(sorted, dependencies, estimateDuration(sorted, complexityOf(workflow)));
    }

    /**
     * Applies targeted fixes: missing release, missing verification, unknown dependency ids,
     * missing predecessor edges and cycles. The repaired workflow is re-optimized.
     */
    public WorkflowDefinition repair(WorkflowDefinition workflow, ValidationResult validation) {
        var repairs = new ArrayList<String>();
        ComplexityLevel complexity = complexityOf(workflow);
        var phases = new ArrayList<>(workflow.phases());

        if (contextsOf(phases).size() > 1 && !contextsOf(phases).contains(ContextType.RELEASE.id())) {
            phases.add(phaseFor(ContextType.RELEASE.id(), workflow.workflowId(), phases.size(), complexity));
            repairs.add("added release phase");
        }
        if (phases.size() > 2 && !contextsOf(phases).contains(ContextType.VERIFICATION.id())) {
            phases.add(phases.size() - 1,
                    phaseFor(ContextType.VERIFICATION.id(), workflow.workflowId(), phases.size(), complexity));
            repairs.add("inserted verification phase");
        }

        Set<String> ids = phases.stream().map(WorkflowPhase::phaseId).collect(Collectors.toSet());
        var dependencies = new LinkedHashMap<String, List<String>>();
        boolean droppedUnknown = false;
        for (var entry : workflow.dependencies().entrySet()) {
            if (!ids.contains(entry.getKey())) {
                droppedUnknown = true;
                continue;
            }
            List<String> known = entry.getValue().stream().filter(ids::contains).toList();
            droppedUnknown |= known.size() != entry.getValue().size();
            if (!known.isEmpty()) {
                dependencies.put(entry.getKey(), new ArrayList<>(known));
            }
        }
        if (droppedUnknown) {
            repairs.add("dropped unknown dependency ids");
        }

        int edgesAdded = 0;
        for (var entry : buildDependencies(phases).entrySet()) {
            List<String> deps = dependencies.computeIfAbsent(entry.getKey(), k -> new ArrayList<>());
            for (String dep : entry.getValue()) {
                if (!deps.contains(dep)) {
                    deps.add(dep);
                    edgesAdded++;
                }
            }
        }
        if (edgesAdded > 0) {
            repairs.add("added " + edgesAdded + " predecessor edges");
        }

        List<String> order = phases.stream().map(WorkflowPhase::phaseId).toList();
        List<DependencyGraph.Edge> backEdges = new DependencyGraph(order, dependencies).backEdges();
        while (!backEdges.isEmpty()) {
            for (DependencyGraph.Edge edge : backEdges) {
                dependencies.getOrDefault(edge.dependent(), new ArrayList<>()).remove(edge.dependency());
                repairs.add("removed cyclic edge " + edge.dependent() + " -> " + edge.dependency());
            }
            backEdges = new DependencyGraph(order, dependencies).backEdges();
        }
        dependencies.values().removeIf(List::isEmpty);

        log.info("Repaired workflow {} after {} violations: {}", workflow.workflowId(),
                validation.messages().size(), repairs);

        WorkflowDefinition repaired = workflow
                .withPhases(phases, dependencies, estimateDuration(phases, complexity))
                .withMetadata(Map.of(META_REPAIRS_APPLIED, List.copyOf(repairs)));
        return optimize(repaired);
    }

    WorkflowDefinition customize(TemplateMatcher.Match match, TaskAnalysis analysis, String workflowId) {
        WorkflowTemplate template = match.template();
        Set<String> required = new LinkedHashSet<>(analysis.requiredContexts());
        Set<String> optional = optionalContexts(template);

        var phases = new ArrayList<WorkflowPhase>();
        for (WorkflowPhase templatePhase : template.phases()) {
            String context = ContextType.canonical(templatePhase.context());
            if (optional.contains(context) && !required.contains(context)) {
                log.debug("Dropping optional template phase {} ({})", templatePhase.phaseId(), context);
                continue;
            }
            phases.add(templatePhase.withPhaseId(workflowId + "_" + templatePhase.phaseId()));
        }

        Set<String> present = contextsOf(phases);
        for (String context : required) {
            if (!present.contains(ContextType.canonical(context))) {
                phases.add(phaseFor(context, workflowId, phases.size(), analysis.complexity()));
            }
        }
        if (phases.isEmpty()) {
            phases.add(phaseFor(ContextType.IMPLEMENTATION.id(), workflowId, 0, analysis.complexity()));
        }

        var metadata = baseMetadata(analysis);
        metadata.put(META_TEMPLATE_USED, template.templateId());
        metadata.put(META_TEMPLATE_SCORE, match.score());
        return definition(analysis, workflowId, phases, metadata);
    }

    WorkflowDefinition synthesize(TaskAnalysis analysis, String workflowId) {
        List<String> contexts = analysis.requiredContexts().stream()
                .distinct()
                .sorted(catalog.logicalOrder())
                .toList();
        if (contexts.isEmpty()) {
            contexts = List.of(ContextType.IMPLEMENTATION.id());
        }
        var phases = new ArrayList<WorkflowPhase>();
        for (String context : contexts) {
            phases.add(phaseFor(context, workflowId, phases.size(), analysis.complexity()));
        }
        var metadata = baseMetadata(analysis);
        return definition(analysis, workflowId, phases, metadata);
    }

    private WorkflowDefinition fallback(TaskAnalysis analysis, String workflowId, RuntimeException cause) {
        var phases = List.of(phaseFor(ContextType.IMPLEMENTATION.id(), workflowId, 0, analysis.complexity()));
        var metadata = baseMetadata(analysis);
        metadata.put("composition_error", String.valueOf(cause.getMessage()));
        return definition(analysis, workflowId, phases, metadata);
    }

    private WorkflowDefinition definition(TaskAnalysis analysis, String workflowId, List<WorkflowPhase> phases,
                                          Map<String, Object> metadata) {
        String description = analysis.description();
        String name = description.isBlank()
                ? "Workflow for " + analysis.taskId()
                : "Workflow for " + (description.length() > 50 ? description.substring(0, 50) + "..." : description);
        return new WorkflowDefinition(
                workflowId,
                name,
                "Automated workflow for: " + description,
                phases,
                buildDependencies(phases),
                estimateDuration(phases, analysis.complexity()),
                qualityGates(analysis),
                metadata,
                Instant.now());
    }

    private Map<String, Object> baseMetadata(TaskAnalysis analysis) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put(META_TASK_ID, analysis.taskId());
        metadata.put(META_COMPLEXITY, analysis.complexity().name());
        metadata.put("required_contexts", analysis.requiredContexts());
        return metadata;
    }

    /**
     * Dependencies from the predecessor table. Every phase depends on all phases of its
     * nearest present predecessor contexts.
     */
    Map<String, List<String>> buildDependencies(List<WorkflowPhase> phases) {
        var byContext = new LinkedHashMap<ContextType, List<String>>();
        for (WorkflowPhase phase : phases) {
            ContextType.fromId(phase.context())
                    .ifPresent(type -> byContext.computeIfAbsent(type, k -> new ArrayList<>()).add(phase.phaseId()));
        }
        Set<ContextType> available = byContext.isEmpty()
                ? EnumSet.noneOf(ContextType.class)
                : EnumSet.copyOf(byContext.keySet());

        var dependencies = new LinkedHashMap<String, List<String>>();
        for (WorkflowPhase phase : phases) {
            var deps = new ArrayList<String>();
            for (ContextType predecessor : catalog.nearestPresentPredecessors(phase.context(), available)) {
                deps.addAll(byContext.get(predecessor));
            }
            if (!deps.isEmpty()) {
                dependencies.put(phase.phaseId(), deps);
            }
        }
        return dependencies;
    }

    private List<WorkflowPhase> applyOrderingRules(List<WorkflowPhase> phases) {
        List<WorkflowPhase> ordered = moveToFront(phases, ContextType.REQUIREMENTS_ANALYSIS);
        ordered = ensureBefore(ordered, ContextType.DESIGN, ContextType.IMPLEMENTATION);
        ordered = ensureBefore(ordered, ContextType.IMPLEMENTATION, ContextType.VERIFICATION);
        return moveToEnd(ordered, ContextType.RELEASE);
    }

    private static List<WorkflowPhase> moveToFront(List<WorkflowPhase> phases, ContextType context) {
        var result = new ArrayList<WorkflowPhase>();
        phases.stream().filter(p -> is(p, context)).forEach(result::add);
        phases.stream().filter(p -> !is(p, context)).forEach(result::add);
        return result;
    }

    private static List<WorkflowPhase> moveToEnd(List<WorkflowPhase> phases, ContextType context) {
        var result = new ArrayList<WorkflowPhase>();
        phases.stream().filter(p -> !is(p, context)).forEach(result::add);
        phases.stream().filter(p -> is(p, context)).forEach(result::add);
        return result;
    }

    /** Moves all {@code first} phases right before the earliest {@code second} phase when any comes after it. */
    private static List<WorkflowPhase> ensureBefore(List<WorkflowPhase> phases, ContextType first, ContextType second) {
        int firstSecond = -1;
        int lastFirst = -1;
        for (int i = 0; i < phases.size(); i++) {
            if (is(phases.get(i), second) && firstSecond < 0) {
                firstSecond = i;
            }
            if (is(phases.get(i), first)) {
                lastFirst = i;
            }
        }
        if (firstSecond < 0 || lastFirst < firstSecond) {
            return phases;
        }
        var result = new ArrayList<WorkflowPhase>();
        for (int i = 0; i < phases.size(); i++) {
            if (i == firstSecond) {
                phases.stream().filter(p -> is(p, first)).forEach(result::add);
            }
            if (!is(phases.get(i), first)) {
                result.add(phases.get(i));
            }
        }
        return result;
    }

    /**
     * Groups parallel-safe phases with no transitive dependency between any two members.
     * Groups are numbered in phase order; singletons stay untagged.
     */
    private List<WorkflowPhase> assignParallelGroups(List<WorkflowPhase> phases, Map<String, List<String>> dependencies) {
        var graph = new DependencyGraph(phases.stream().map(WorkflowPhase::phaseId).toList(), dependencies);
        var groups = new ArrayList<List<String>>();
        var grouped = new HashSet<String>();

        for (WorkflowPhase phase : phases) {
            if (grouped.contains(phase.phaseId()) || !catalog.isParallelSafe(phase.context())) {
                continue;
            }
            var group = new ArrayList<String>();
            group.add(phase.phaseId());
            grouped.add(phase.phaseId());
            for (WorkflowPhase other : phases) {
                if (grouped.contains(other.phaseId()) || !catalog.isParallelSafe(other.context())) {
                    continue;
                }
                boolean independent = group.stream().noneMatch(member -> graph.related(member, other.phaseId()));
                if (independent) {
                    group.add(other.phaseId());
                    grouped.add(other.phaseId());
                }
            }
            groups.add(group);
        }

        var tags = new LinkedHashMap<String, String>();
        int counter = 0;
        for (List<String> group : groups) {
            if (group.size() < 2) {
                continue;
            }
            counter++;
            for (String member : group) {
                tags.put(member, "parallel_group_" + counter);
            }
        }
        return phases.stream().map(p -> p.withParallelGroup(tags.get(p.phaseId()))).toList();
    }

    private WorkflowPhase phaseFor(String context, String workflowId, int index, ComplexityLevel complexity) {
        ContextProfile profile = catalog.profile(context).orElse(catalog.profile(ContextType.GENERAL));
        String suffix = ContextType.canonical(context).replace('-', '_').replace("@", "");
        return new WorkflowPhase(
                workflowId + "_" + suffix + "_" + index,
                ContextType.canonical(context),
                profile.phaseName(),
                profile.phaseDescription(),
                profile.inputs(),
                profile.outputs(),
                null,
                catalog.timeoutFor(context, complexity),
                defaultRetryCount,
                profile.qualityGates(),
                null);
    }

    /** Σ timeouts in minutes, scaled by complexity, at least 15. */
    static int estimateDuration(Collection<WorkflowPhase> phases, ComplexityLevel complexity) {
        int total = phases.stream().mapToInt(WorkflowPhase::timeoutSeconds).sum() / 60;
        if (complexity == ComplexityLevel.COMPLEX) {
            total = (int) (total * 1.3);
        } else if (complexity == ComplexityLevel.SIMPLE) {
            total = (int) (total * 0.8);
        }
        return Math.max(15, total);
    }

    static List<String> qualityGates(TaskAnalysis analysis) {
        var gates = new ArrayList<>(List.of("basic_validation", "error_free_execution"));
        if (analysis.complexity() != ComplexityLevel.SIMPLE) {
            gates.addAll(List.of("comprehensive_testing", "code_quality_check"));
        }
        if (analysis.hasEntityType("security")) {
            gates.add("security_validation");
        }
        if (analysis.hasEntityType("performance")) {
            gates.add("performance_validation");
        }
        return gates;
    }

    private static Set<String> optionalContexts(WorkflowTemplate template) {
        Object value = template.parameters().get("optional_contexts");
        if (!(value instanceof Collection<?> values)) {
            return Set.of();
        }
        return values.stream().map(String::valueOf).map(ContextType::canonical).collect(Collectors.toSet());
    }

    private static ComplexityLevel complexityOf(WorkflowDefinition workflow) {
        Object value = workflow.metadata().get(META_COMPLEXITY);
        if (value != null) {
            try {
                return ComplexityLevel.valueOf(value.toString());
            } catch (IllegalArgumentException e) {
                log.debug("Unknown complexity '{}' in workflow {} metadata", value, workflow.workflowId());
            }
        }
        return ComplexityLevel.MEDIUM;
    }

    private static List<String> repairsOf(WorkflowDefinition workflow) {
        Object value = workflow.metadata().get(META_REPAIRS_APPLIED);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static Set<String> contextsOf(Collection<WorkflowPhase> phases) {
        return phases.stream().map(p -> ContextType.canonical(p.context())).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean is(WorkflowPhase phase, ContextType context) {
        return ContextType.fromId(phase.context()).map(context::equals).orElse(false);
    }
}
