package com.contextflow.core.analysis;

import com.contextflow.config.ContextFlowProperties;
import com.contextflow.core.context.ContextCatalog;
import com.contextflow.core.context.ContextType;
import com.contextflow.core.model.ComplexityLevel;
import com.contextflow.core.model.Entity;
import com.contextflow.core.model.TaskAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-text task description into a {@link TaskAnalysis}: entities, complexity,
 * required contexts, duration estimate, dependencies, success criteria and confidence.
 * <p>
 * Purely heuristic and deterministic for a given description and hint map, apart from the
 * generated task id and timestamp. Never throws for null or empty input; it degrades to a
 * minimal analysis instead.
 */
@Service
public class TaskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TaskAnalyzer.class);

    public static final String HINT_PROJECT_SIZE = "project_size";
    public static final String HINT_TEAM_EXPERIENCE = "team_experience";

    private static final DateTimeFormatter TASK_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final Set<String> HIGH_COMPLEXITY_TYPES =
            Set.of("system", "architecture", "integration", "security", "performance");
    private static final Set<String> MEDIUM_COMPLEXITY_TYPES = Set.of("feature", "component", "service", "api");
    private static final Set<String> LONG_RUNNING_TYPES = Set.of("system", "architecture", "integration", "security");

    private static final Map<String, Double> COMPLEXITY_INDICATORS = new LinkedHashMap<>();

    static {
        COMPLEXITY_INDICATORS.put("complex", 0.4);
        for (String word : List.of("complicated", "advanced", "sophisticated", "enterprise", "distributed", "migration")) {
            COMPLEXITY_INDICATORS.put(word, 0.3);
        }
        for (String word : List.of("scalable", "microservice", "integration", "refactor", "very")) {
            COMPLEXITY_INDICATORS.put(word, 0.2);
        }
        COMPLEXITY_INDICATORS.put("architecture", 0.15);
        for (String word : List.of("multiple", "various", "several", "many")) {
            COMPLEXITY_INDICATORS.put(word, 0.1);
        }
        COMPLEXITY_INDICATORS.put("system", 0.05);
        COMPLEXITY_INDICATORS.put("authentication", 0.05);
    }

    private static final Map<String, List<ContextType>> ENTITY_CONTEXTS = Map.of(
            "feature", List.of(ContextType.REQUIREMENTS_ANALYSIS, ContextType.DESIGN,
                    ContextType.IMPLEMENTATION, ContextType.VERIFICATION),
            "bug", List.of(ContextType.DEBUGGING, ContextType.VERIFICATION, ContextType.IMPLEMENTATION),
            "security", List.of(ContextType.SECURITY_REVIEW, ContextType.IMPLEMENTATION, ContextType.VERIFICATION),
            "performance", List.of(ContextType.OPTIMIZATION, ContextType.VERIFICATION, ContextType.IMPLEMENTATION),
            "api", List.of(ContextType.IMPLEMENTATION, ContextType.VERIFICATION, ContextType.DOCUMENTATION),
            "database", List.of(ContextType.IMPLEMENTATION, ContextType.VERIFICATION, ContextType.SECURITY_REVIEW),
            "ui", List.of(ContextType.IMPLEMENTATION, ContextType.VERIFICATION, ContextType.DESIGN),
            "component", List.of(ContextType.IMPLEMENTATION)
    );

    private static final List<Pattern> DEPENDENCY_PATTERNS = List.of(
            Pattern.compile("\\bdepends on ([^,.]+)"),
            Pattern.compile("\\brequires ([^,.]+)"),
            Pattern.compile("\\bneeds ([^,.]+)"),
            Pattern.compile("\\bafter ([^,.]+)"),
            Pattern.compile("\\bonce ([^,.]+) is complete")
    );

    private final ContextCatalog catalog;
    private final ContextFlowProperties.Analyzer settings;

    public TaskAnalyzer(ContextCatalog catalog, ContextFlowProperties properties) {
        this.catalog = catalog;
        this.settings = properties.getAnalyzer();
    }

    public TaskAnalysis analyze(String description) {
        return analyze(description, Map.of());
    }

    /**
     * Analyzes a task description.
     *
     * @param description free-text description, may be null or empty
     * @param hints       optional project hints ({@code project_size}, {@code team_experience}), may be null
     */
    public TaskAnalysis analyze(String description, Map<String, Object> hints) {
        String text = description == null ? "" : description;
        Map<String, Object> context = hints == null ? Map.of() : hints;
        String lowerText = text.toLowerCase();

        List<Entity> entities = extractEntities(lowerText);
        double complexityScore = complexityScore(entities, lowerText, context);
        ComplexityLevel complexity = complexityLevel(complexityScore);
        List<String> contexts = identifyContexts(entities, lowerText, complexity);
        int duration = estimateDuration(complexity, contexts, entities);
        List<String> dependencies = identifyDependencies(entities, lowerText);
        List<String> criteria = successCriteria(entities);
        double confidence = confidence(text, entities, contexts, complexity);

        var analysis = new TaskAnalysis(taskId(text), text, entities, complexity, contexts, duration,
                dependencies, criteria, confidence, Instant.now());

        log.info("Analyzed task {}: complexity={} (score {}), contexts={}, entities={}, confidence={}",
                analysis.taskId(), complexity, String.format("%.2f", complexityScore), contexts,
                entities.size(), String.format("%.2f", confidence));
        return analysis;
    }

    List<Entity> extractEntities(String lowerText) {
        var seen = new HashSet<String>();
        var entities = new ArrayList<Entity>();
        for (EntityPatterns.EntityMatch match : EntityPatterns.scan(lowerText)) {
            String key = match.name().toLowerCase() + "|" + match.type();
            if (!seen.add(key)) {
                continue;
            }
            double confidence = EntityPatterns.confidence(match.name(), match.type(), lowerText);
            entities.add(new Entity(match.name(), match.type(), confidence,
                    Map.of("position", match.position(), "length", match.name().length())));
        }
        // List.sort is stable, so ties keep pattern order
        entities.sort(Comparator.comparingDouble(Entity::confidence).reversed());
        return entities.size() > settings.getMaxEntities()
                ? List.copyOf(entities.subList(0, settings.getMaxEntities()))
                : entities;
    }

    double complexityScore(List<Entity> entities, String lowerText, Map<String, Object> hints) {
        double score = entities.size() * 0.1;
        for (Entity entity : entities) {
            if (HIGH_COMPLEXITY_TYPES.contains(entity.type())) {
                score += 0.3;
            } else if (MEDIUM_COMPLEXITY_TYPES.contains(entity.type())) {
                score += 0.2;
            } else {
                score += 0.1;
            }
        }

        for (var indicator : COMPLEXITY_INDICATORS.entrySet()) {
            int occurrences = EntityPatterns.countOccurrences(lowerText, indicator.getKey());
            score += indicator.getValue() * occurrences;
        }

        int wordCount = lowerText.isBlank() ? 0 : lowerText.trim().split("\\s+").length;
        if (wordCount > 200) {
            score += 1.0;
        } else if (wordCount > 100) {
            score += 0.5;
        }

        Object projectSize = hints.get(HINT_PROJECT_SIZE);
        if ("large".equals(projectSize)) {
            score += 0.2;
        } else if ("small".equals(projectSize)) {
            score -= 0.1;
        }
        Object experience = hints.get(HINT_TEAM_EXPERIENCE);
        if ("junior".equals(experience)) {
            score += 0.1;
        } else if ("senior".equals(experience)) {
            score -= 0.1;
        }
        return score;
    }

    ComplexityLevel complexityLevel(double score) {
        if (score >= settings.getComplexThreshold()) {
            return ComplexityLevel.COMPLEX;
        }
        if (score >= settings.getMediumThreshold()) {
            return ComplexityLevel.MEDIUM;
        }
        return ComplexityLevel.SIMPLE;
    }

    List<String> identifyContexts(List<Entity> entities, String lowerText, ComplexityLevel complexity) {
        var contexts = EnumSet.noneOf(ContextType.class);
        contexts.addAll(ContextPatterns.detect(lowerText));

        for (Entity entity : entities) {
            contexts.addAll(ENTITY_CONTEXTS.getOrDefault(entity.type(), List.of()));
        }

        if (complexity == ComplexityLevel.COMPLEX) {
            contexts.addAll(List.of(ContextType.DESIGN, ContextType.SECURITY_REVIEW, ContextType.VERIFICATION));
        } else if (complexity == ComplexityLevel.MEDIUM) {
            contexts.add(ContextType.VERIFICATION);
        }

        if (contexts.isEmpty()) {
            contexts.add(ContextType.IMPLEMENTATION);
        }
        boolean documentationOnly = contexts.size() == 1 && contexts.contains(ContextType.DOCUMENTATION);
        if (!documentationOnly) {
            contexts.add(ContextType.RELEASE);
        }

        return contexts.stream()
                .map(ContextType::id)
                .sorted(catalog.logicalOrder())
                .toList();
    }

    int estimateDuration(ComplexityLevel complexity, List<String> contexts, List<Entity> entities) {
        int base = switch (complexity) {
            case SIMPLE -> 30;
            case MEDIUM -> 90;
            case COMPLEX -> 240;
        };
        int total = base + contexts.size() * 15 + entities.size() * 2;
        for (Entity entity : entities) {
            if (LONG_RUNNING_TYPES.contains(entity.type())) {
                total += 10;
            }
        }
        return Math.max(5, (int) Math.round(total / 5.0) * 5);
    }

    List<String> identifyDependencies(List<Entity> entities, String lowerText) {
        var dependencies = new LinkedHashSet<String>();
        for (Pattern pattern : DEPENDENCY_PATTERNS) {
            Matcher matcher = pattern.matcher(lowerText);
            while (matcher.find()) {
                String dependency = matcher.group(1).trim();
                if (!dependency.isEmpty() && dependency.length() < 100) {
                    dependencies.add(dependency);
                }
            }
        }
        entities.stream()
                .filter(e -> "prerequisite".equals(e.type()))
                .forEach(e -> dependencies.add(e.name()));
        return List.copyOf(dependencies);
    }

    List<String> successCriteria(List<Entity> entities) {
        var criteria = new ArrayList<String>();
        if (hasType(entities, "feature")) {
            criteria.addAll(List.of(
                    "Feature implementation is complete and functional",
                    "All acceptance criteria are met",
                    "Unit tests pass with adequate coverage",
                    "Code review is completed and approved"));
        }
        if (hasType(entities, "bug")) {
            criteria.addAll(List.of(
                    "Bug is reproduced and root cause identified",
                    "Fix is implemented and tested",
                    "Regression tests pass",
                    "No new issues are introduced"));
        }
        if (hasType(entities, "security")) {
            criteria.addAll(List.of(
                    "Security vulnerability is addressed",
                    "Security tests pass",
                    "No new security risks are introduced"));
        }
        if (hasType(entities, "performance")) {
            criteria.addAll(List.of(
                    "Performance requirements are met",
                    "Performance tests pass",
                    "No performance regressions"));
        }
        if (criteria.isEmpty()) {
            criteria.addAll(List.of(
                    "Implementation meets requirements",
                    "All tests pass",
                    "Code quality standards are met",
                    "Documentation is updated"));
        }
        return criteria;
    }

    double confidence(String description, List<Entity> entities, List<String> contexts, ComplexityLevel complexity) {
        double confidence = description.trim().length() < 5 ? 0.2 : 0.3;
        if (!entities.isEmpty()) {
            double mean = entities.stream().mapToDouble(Entity::confidence).average().orElse(0.0);
            confidence += mean * 0.3;
        }
        if (!contexts.isEmpty()) {
            confidence += Math.min(0.2, contexts.size() * 0.05);
        }
        if (complexity != ComplexityLevel.SIMPLE) {
            confidence += 0.1;
        }
        return Math.min(1.0, confidence);
    }

    static String taskId(String description) {
        String timestamp = LocalDateTime.now().format(TASK_ID_TIME);
        String random = UUID.randomUUID().toString().substring(0, 8);
        return "task_" + timestamp + "_" + contentHash(description) + "_" + random;
    }

    private static String contentHash(String description) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(description.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }

    private static boolean hasType(List<Entity> entities, String type) {
        return entities.stream().anyMatch(e -> type.equals(e.type()));
    }
}
