package com.contextflow.core.context;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of capability contexts a workflow phase can be bound to.
 * <p>
 * Each context has a stable id used on the wire and in templates, plus the
 * legacy {@code @keyword} form still accepted when resolving names.
 */
public enum ContextType {
    REQUIREMENTS_ANALYSIS("requirements-analysis", "@agile"),
    DESIGN("design", "@design"),
    IMPLEMENTATION("implementation", "@code"),
    VERIFICATION("verification", "@test"),
    DEBUGGING("debugging", "@debug"),
    DOCUMENTATION("documentation", "@docs"),
    SECURITY_REVIEW("security-review", "@security"),
    OPTIMIZATION("optimization", "@optimize"),
    RELEASE("release", "@git"),
    RESEARCH("research", "@research"),
    GENERAL("general", "@default");

    private final String id;
    private final String keyword;

    ContextType(String id, String keyword) {
        this.id = id;
        this.keyword = keyword;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a context by id, legacy keyword or enum name (case-insensitive).
     */
    public static Optional<ContextType> fromId(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(c -> c.id.equals(normalized)
                        || c.keyword.equals(normalized)
                        || c.name().equalsIgnoreCase(normalized.replace('-', '_')))
                .findFirst();
    }

    public static boolean isKnown(String name) {
        return fromId(name).isPresent();
    }

    /**
     * Returns the canonical id for a context name, or the name unchanged when it is unknown.
     */
    public static String canonical(String name) {
        return fromId(name).map(ContextType::id).orElse(name);
    }
}
