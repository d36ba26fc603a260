package com.contextflow.core.analysis;

import com.contextflow.core.context.ContextType;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword patterns that signal a context directly from the task wording,
 * independent of the extracted entities.
 */
public final class ContextPatterns {

    private static final Map<ContextType, List<Pattern>> PATTERNS = new LinkedHashMap<>();

    static {
        register(ContextType.IMPLEMENTATION,
                "\\b(implement|build|create|develop|code|program|write)\\b",
                "\\b(function|method|class|module|component|service)\\b",
                "\\b(algorithm|logic|functionality)\\b");
        register(ContextType.DEBUGGING,
                "\\b(debug|fix|troubleshoot|resolve|investigate)\\b",
                "\\b(bug|error|issue|problem|failure)\\b",
                "\\b(broken|failing|not working)\\b");
        register(ContextType.VERIFICATION,
                "\\b(test|testing|verify|validate|check)\\b",
                "\\b(unit test|integration test|test suite)\\b",
                "\\b(coverage|quality assurance|qa)\\b",
                "\\b(create|implement|build|dashboard|feature)\\b");
        register(ContextType.REQUIREMENTS_ANALYSIS,
                "\\b(user story|sprint|backlog|scrum)\\b",
                "\\b(requirements|acceptance criteria)\\b",
                "\\b(epic|story points|planning)\\b",
                "\\b(feature|dashboard|user)\\b");
        register(ContextType.DESIGN,
                "\\b(design|architecture|structure|pattern)\\b",
                "\\b(system design|architectural|blueprint)\\b",
                "\\b(framework|infrastructure|foundation)\\b",
                "\\b(dashboard|interface|ui|ux)\\b");
        register(ContextType.DOCUMENTATION,
                "\\b(document|documentation|readme|guide)\\b",
                "\\b(manual|wiki|help|tutorial)\\b",
                "\\b(api doc|user guide|specification)\\b");
        register(ContextType.SECURITY_REVIEW,
                "\\b(security|secure|vulnerability|exploit)\\b",
                "\\b(authentication|authorization|encryption)\\b",
                "\\b(audit|penetration|compliance)\\b");
        register(ContextType.OPTIMIZATION,
                "\\b(optimize|performance|speed|efficiency)\\b",
                "\\b(benchmark|profiling|tuning)\\b",
                "\\b(scalability|throughput|latency)\\b");
        register(ContextType.RELEASE,
                "\\b(commit|push|deploy|release)\\b",
                "\\b(version control|git|repository)\\b",
                "\\b(merge|branch|pull request)\\b");
    }

    private ContextPatterns() {} // utility class

    /**
     * Contexts whose patterns match anywhere in the text.
     */
    public static Set<ContextType> detect(String lowerText) {
        var detected = EnumSet.noneOf(ContextType.class);
        if (lowerText == null || lowerText.isBlank()) {
            return detected;
        }
        PATTERNS.forEach((context, patterns) -> {
            if (patterns.stream().anyMatch(p -> p.matcher(lowerText).find())) {
                detected.add(context);
            }
        });
        return detected;
    }

    private static void register(ContextType context, String... regexes) {
        PATTERNS.put(context, Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList());
    }
}
