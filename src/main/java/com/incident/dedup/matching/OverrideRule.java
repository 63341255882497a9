package com.incident.dedup.matching;

import java.util.function.Predicate;

/**
 * A hand-authored heuristic that can force a match or a non-match for one candidate.
 */
public interface OverrideRule {

    String name();

    /**
     * Returns a forced outcome when the rule fires, otherwise {@link OverrideOutcome#noOverride()}.
     */
    OverrideOutcome evaluate(MatchSignals signals);

    static OverrideRule forceMatch(String name, String reason, Predicate<MatchSignals> condition) {
        return new PredicateRule(name, condition, OverrideOutcome.forcedMatch(name, reason));
    }

    static OverrideRule forceNonMatch(String name, String reason, Predicate<MatchSignals> condition) {
        return new PredicateRule(name, condition, OverrideOutcome.forcedNonMatch(name, reason));
    }

    record PredicateRule(String name, Predicate<MatchSignals> condition, OverrideOutcome whenFired)
            implements OverrideRule {

        @Override
        public OverrideOutcome evaluate(MatchSignals signals) {
            return condition.test(signals) ? whenFired : OverrideOutcome.noOverride();
        }
    }
}
