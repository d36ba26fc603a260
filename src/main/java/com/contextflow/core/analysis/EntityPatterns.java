package com.contextflow.core.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex library used to pull candidate entities out of a task description.
 * <p>
 * Patterns run case-insensitively over lowercased text. Captured names are
 * bounded to at most four words so a match never swallows the rest of a sentence.
 */
public final class EntityPatterns {

    /**
     * A raw match before scoring.
     *
     * @param name     the captured phrase, trimmed
     * @param type     entity type
     * @param position offset of the match in the scanned text
     */
    public record EntityMatch(String name, String type, int position) {}

    private record TypedPattern(String type, Pattern pattern, int nameGroup) {}

    private static final String PHRASE = "([a-z0-9]+(?:\\s+[a-z0-9]+){0,3})";
    private static final String ISSUE_PHRASE = "([a-z0-9#]+(?:\\s+[a-z0-9#]+){0,3})";
    private static final String ROUTE_PHRASE = "([a-z0-9/]+(?:\\s+[a-z0-9/]+){0,3})";

    private static final List<TypedPattern> PATTERNS = List.of(
            typed("feature", "\\b(?:feature|functionality|capability)\\s+" + PHRASE, 1),
            typed("feature", "\\b(?:add|create|build)\\s+" + PHRASE + "\\s+(?:feature|function)\\b", 1),
            typed("feature", "\\b" + PHRASE + "\\s+feature\\b", 1),
            typed("feature", "\\b(?:implement|develop)\\s+" + PHRASE + "\\s+(?:dashboard|feature|functionality)\\b", 1),

            typed("bug", "\\b(?:bug|issue|problem|error)\\s+" + ISSUE_PHRASE, 1),
            typed("bug", "\\b(?:fix|resolve)\\s+" + PHRASE + "\\s+(?:bug|issue)\\b", 1),
            typed("bug", "\\b" + PHRASE + "\\s+(?:not working|broken|failing)\\b", 1),

            typed("component", "\\b(?:component|module|service|class)\\s+" + PHRASE, 1),
            typed("component", "\\b([a-z][a-z0-9]*(?:component|service))\\b", 1),
            typed("component", "\\b" + PHRASE + "\\s+(?:component|module)\\b", 1),

            typed("api", "\\b(?:api|endpoint|route)\\s+" + ROUTE_PHRASE, 1),
            typed("api", "\\b" + PHRASE + "\\s+(?:api|endpoint)\\b", 1),
            typed("api", "\\b(?:rest|graphql|http)\\s+" + PHRASE, 1),

            typed("database", "\\b(?:database|table|schema|model)\\s+" + PHRASE, 1),
            typed("database", "\\b" + PHRASE + "\\s+(?:database|table|model)\\b", 1),
            typed("database", "\\b(?:sql|nosql|mongodb|postgresql|mysql)\\s+" + PHRASE, 1),

            typed("ui", "\\b(?:ui|interface|screen|page|form)\\s+" + PHRASE, 1),
            typed("ui", "\\b" + PHRASE + "\\s+(?:ui|interface|screen|page)\\b", 1),
            typed("ui", "\\b(?:frontend|client|web)\\s+" + PHRASE, 1),
            typed("ui", "\\b(dashboard|panel|widget|chart)\\b", 1),

            typed("security", "\\b(?:security|vulnerability|exploit)\\s+" + PHRASE, 1),
            typed("security", "\\b" + PHRASE + "\\s+(?:security|vulnerability)\\b", 1),
            typed("security", "\\b(?:auth|authentication|authorization)\\s+" + PHRASE, 1),

            typed("performance", "\\b(?:performance|optimization|speed)\\s+" + PHRASE, 1),
            typed("performance", "\\b" + PHRASE + "\\s+(?:performance|optimization)\\b", 1),
            typed("performance", "\\b(?:slow|fast|efficient)\\s+" + PHRASE, 1),

            typed("prerequisite", "\\bprerequisites?\\s*:?\\s+" + PHRASE, 1)
    );

    /** Words that raise confidence for an entity type when they appear anywhere in the text. */
    private static final Map<String, List<String>> CONTEXT_WORDS = Map.of(
            "feature", List.of("implement", "add", "create", "build"),
            "bug", List.of("fix", "resolve", "debug", "issue"),
            "component", List.of("module", "service", "class"),
            "api", List.of("endpoint", "route", "rest", "http")
    );

    private EntityPatterns() {} // utility class

    /**
     * Runs every pattern over the text, in declaration order.
     *
     * @param lowerText lowercased task description
     * @return raw matches, possibly with duplicates
     */
    public static List<EntityMatch> scan(String lowerText) {
        if (lowerText == null || lowerText.isBlank()) {
            return List.of();
        }
        var matches = new ArrayList<EntityMatch>();
        for (TypedPattern typed : PATTERNS) {
            Matcher matcher = typed.pattern().matcher(lowerText);
            while (matcher.find()) {
                String name = matcher.group(typed.nameGroup());
                if (name != null && !name.isBlank()) {
                    matches.add(new EntityMatch(name.trim(), typed.type(), matcher.start()));
                }
            }
        }
        return matches;
    }

    /**
     * Confidence for a candidate entity: 0.5 base, +0.2 for a clean alphanumeric name longer
     * than two characters, up to +0.2 for repeated occurrences, +0.1 when a type-specific
     * context word appears in the text.
     */
    public static double confidence(String name, String type, String lowerText) {
        double confidence = 0.5;
        if (name.length() > 2 && isAlphanumeric(name)) {
            confidence += 0.2;
        }
        int occurrences = countOccurrences(lowerText, name.toLowerCase());
        confidence += Math.min(0.2, occurrences * 0.05);

        List<String> words = CONTEXT_WORDS.get(type);
        if (words != null && words.stream().anyMatch(lowerText::contains)) {
            confidence += 0.1;
        }
        return Math.min(1.0, confidence);
    }

    static int countOccurrences(String text, String fragment) {
        if (fragment.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(fragment, from)) >= 0) {
            count++;
            from += fragment.length();
        }
        return count;
    }

    private static boolean isAlphanumeric(String value) {
        return value.chars().allMatch(Character::isLetterOrDigit);
    }

    private static TypedPattern typed(String type, String regex, int nameGroup) {
        return new TypedPattern(type, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), nameGroup);
    }
}
