package com.contextflow.core.composition;

import com.contextflow.core.context.ContextType;
import com.contextflow.core.model.PhaseCondition;
import com.contextflow.core.model.WorkflowPhase;
import com.contextflow.core.model.WorkflowTemplate;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads workflow templates from YAML files under a classpath or filesystem location.
 * <p>
 * Each file holds one template:
 * <pre>
 * name: feature-development
 * category: feature_development
 * contexts:
 *   - phase: implement
 *     context: implementation
 *     timeout: 1800
 * </pre>
 * Phases may also be listed under {@code phases}. Unreadable files are logged and skipped;
 * a missing location yields an empty library.
 */
public class YamlTemplateLibrary implements TemplateLibrary {

    private static final Logger log = LoggerFactory.getLogger(YamlTemplateLibrary.class);

    private static final int DEFAULT_PHASE_TIMEOUT = 300;
    private static final int DEFAULT_RETRY_COUNT = 3;
    private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE =
            new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper mapper = new YAMLMapper();
    private final List<WorkflowTemplate> templates;

    /**
     * @param location {@code classpath:} location, {@code file:} URL or plain directory path
     */
    public YamlTemplateLibrary(String location) {
        this.templates = List.copyOf(load(location));
        log.info("Loaded {} workflow templates from {}", templates.size(), location);
    }

    @Override
    public List<WorkflowTemplate> templates() {
        return templates;
    }

    private List<WorkflowTemplate> load(String location) {
        var loaded = new LinkedHashMap<String, WorkflowTemplate>();
        if (location == null || location.isBlank()) {
            return List.of();
        }
        var resolver = new PathMatchingResourcePatternResolver();
        var resources = new ArrayList<Resource>();
        for (String pattern : patterns(location)) {
            try {
                resources.addAll(List.of(resolver.getResources(pattern)));
            } catch (IOException e) {
                log.warn("Template location {} not readable: {}", pattern, e.getMessage());
            }
        }
        resources.sort(Comparator.comparing(r -> String.valueOf(r.getFilename())));

        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                WorkflowTemplate template = toTemplate(mapper.readTree(in), resource.getFilename());
                loaded.putIfAbsent(template.templateId(), template);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to load template {}: {}", resource.getDescription(), e.getMessage());
            }
        }
        return new ArrayList<>(loaded.values());
    }

    private static List<String> patterns(String location) {
        String base = location.endsWith("/") ? location : location + "/";
        if (base.startsWith("classpath:")) {
            base = "classpath*:" + base.substring("classpath:".length());
        } else if (!base.startsWith("classpath*:") && !base.startsWith("file:")) {
            base = "file:" + base;
        }
        return List.of(base + "**/*.yaml", base + "**/*.yml");
    }

    private Map<String, Object> parameters(JsonNode node, String templateName) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            log.warn("Ignoring parameters of template {}: expected a mapping, got {}", templateName, node.getNodeType());
            return Map.of();
        }
        return mapper.convertValue(node, PARAMETERS_TYPE);
    }

    WorkflowTemplate toTemplate(JsonNode root, String filename) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Template " + filename + " is not a mapping");
        }
        String name = text(root, "name", null);
        if (name == null) {
            throw new IllegalArgumentException("Template " + filename + " has no name");
        }
        JsonNode phaseNodes = root.has("contexts") ? root.get("contexts") : root.get("phases");
        var phases = new ArrayList<WorkflowPhase>();
        if (phaseNodes != null && phaseNodes.isArray()) {
            for (JsonNode node : phaseNodes) {
                phases.add(toPhase(node, phases.size()));
            }
        }
        Map<String, Object> parameters = parameters(root.get("parameters"), name);
        Integer averageDuration = root.hasNonNull("average_duration") ? root.get("average_duration").asInt() : null;

        return new WorkflowTemplate(
                text(root, "id", name),
                name,
                text(root, "description", ""),
                text(root, "category", "general"),
                phases,
                parameters,
                strings(root.get("tags")),
                root.path("usage_count").asInt(0),
                root.path("success_rate").asDouble(0.0),
                averageDuration);
    }

    private WorkflowPhase toPhase(JsonNode node, int index) {
        String context = text(node, "context", null);
        if (context == null) {
            throw new IllegalArgumentException("Template phase " + index + " has no context");
        }
        String phaseId = text(node, "phase", text(node, "id", "phase_" + index));
        String condition = text(node, "condition", null);
        return new WorkflowPhase(
                phaseId,
                ContextType.canonical(context),
                text(node, "name", phaseId),
                text(node, "description", ""),
                strings(node.get("inputs")),
                strings(node.get("outputs")),
                condition == null ? null : PhaseCondition.inputPresent(condition),
                node.path("timeout").asInt(DEFAULT_PHASE_TIMEOUT),
                node.path("retry_count").asInt(DEFAULT_RETRY_COUNT),
                strings(node.get("quality_gates")),
                text(node, "parallel_group", null));
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        var values = new ArrayList<String>();
        node.forEach(v -> values.add(v.asText()));
        return values;
    }
}
