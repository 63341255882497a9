package com.incident.dedup.matching;

import java.util.Objects;

/**
 * Result of evaluating the override rules for one candidate.
 *
 * @param kind   forced match, forced non-match, or no override
 * @param rule   name of the deciding rule, null for {@link Kind#NO_OVERRIDE}
 * @param reason human-readable explanation
 */
public record OverrideOutcome(Kind kind, String rule, String reason) {

    public enum Kind {
        FORCED_MATCH,
        FORCED_NON_MATCH,
        NO_OVERRIDE
    }

    private static final OverrideOutcome NONE = new OverrideOutcome(Kind.NO_OVERRIDE, null, null);

    public OverrideOutcome {
        Objects.requireNonNull(kind, "kind is required");
    }

    public static OverrideOutcome forcedMatch(String rule, String reason) {
        return new OverrideOutcome(Kind.FORCED_MATCH, rule, reason);
    }

    public static OverrideOutcome forcedNonMatch(String rule, String reason) {
        return new OverrideOutcome(Kind.FORCED_NON_MATCH, rule, reason);
    }

    public static OverrideOutcome noOverride() {
        return NONE;
    }

    public boolean isForcedMatch() {
        return kind == Kind.FORCED_MATCH;
    }

    public boolean isForcedNonMatch() {
        return kind == Kind.FORCED_NON_MATCH;
    }
}
