package com.incident.dedup.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex rewrite. Lower priorities run first.
 *
 * @param name        unique rule name, used for removal
 * @param pattern     compiled pattern
 * @param replacement replacement text, "" to strip the match
 * @param priority    ordering key
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * Rule that deletes every match.
     */
    public static NormalizationRule strip(String name, String regex, int priority) {
        return rewrite(name, regex, "", priority);
    }

    public static NormalizationRule rewrite(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement, priority);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + "[" + pattern.pattern() + " -> '" + replacement + "' @" + priority + "]";
    }
}
