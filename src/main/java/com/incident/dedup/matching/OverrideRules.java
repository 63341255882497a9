package com.incident.dedup.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered override rules of ingest-time matching.
 *
 * <p>Every rule is evaluated. A forced non-match from any rule vetoes forced matches and a
 * passing numeric score alike; otherwise the first forced match in declaration order decides.</p>
 */
public class OverrideRules {
    private static final Logger log = LoggerFactory.getLogger(OverrideRules.class);

    // near-perfect time and space
    static final double NEAR_PERFECT_TIME = 0.95;
    static final double NEAR_PERFECT_SPATIAL = 0.95;

    // close in time and space with a reasonable vessel match
    static final double CLOSE_TIME = 0.75;
    static final double CLOSE_SPATIAL = 0.9;
    static final double CLOSE_VESSEL = 0.7;

    // strong vessel match with moderate time and space
    static final double STRONG_VESSEL = 0.8;
    static final double STRONG_VESSEL_TIME = 0.5;
    static final double STRONG_VESSEL_SPATIAL = 0.7;

    // same incident-type category with good time and space
    static final double TYPE_CATEGORY = 0.8;
    static final double TYPE_TIME = 0.6;
    static final double TYPE_SPATIAL = 0.7;

    // shared keyword signature with reasonable time and space
    static final double KEYWORD_TIME = 0.5;
    static final double KEYWORD_SPATIAL = 0.6;

    // similar vessel names, very poor time and space
    static final double SAFEGUARD_VESSEL = 0.8;
    static final double SAFEGUARD_TIME = 0.2;
    static final double SAFEGUARD_SPATIAL = 0.3;

    private final List<OverrideRule> rules;

    public OverrideRules(List<OverrideRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static OverrideRules defaults() {
        return new OverrideRules(List.of(
                OverrideRule.forceMatch("close-with-vessel",
                        "Close in time and space with a matching vessel",
                        s -> s.time() > CLOSE_TIME && s.spatial() > CLOSE_SPATIAL
                                && s.vesselSimilarity() >= CLOSE_VESSEL),
                OverrideRule.forceMatch("strong-vessel",
                        "Strong vessel match with moderate time and space proximity",
                        s -> s.vesselSimilarity() > STRONG_VESSEL && s.time() > STRONG_VESSEL_TIME
                                && s.spatial() > STRONG_VESSEL_SPATIAL),
                OverrideRule.forceMatch("near-perfect-time-space",
                        "Near-identical time and position",
                        s -> s.time() > NEAR_PERFECT_TIME && s.spatial() > NEAR_PERFECT_SPATIAL),
                OverrideRule.forceMatch("type-category",
                        "Same incident-type category with good time and space proximity",
                        s -> s.incidentTypeSimilarity() >= TYPE_CATEGORY && s.time() > TYPE_TIME
                                && s.spatial() > TYPE_SPATIAL),
                OverrideRule.forceMatch("keyword-signature",
                        "Both reports describe the same kind of stolen or targeted items",
                        s -> s.hasSharedKeywordSignature() && s.time() > KEYWORD_TIME
                                && s.spatial() > KEYWORD_SPATIAL),
                OverrideRule.forceNonMatch("similar-vessel-far-apart",
                        "Similar vessel names but very different time and location",
                        s -> s.vesselSimilarity() > SAFEGUARD_VESSEL && s.time() < SAFEGUARD_TIME
                                && s.spatial() < SAFEGUARD_SPATIAL)
        ));
    }

    public OverrideOutcome evaluate(MatchSignals signals) {
        OverrideOutcome firstMatch = null;
        for (OverrideRule rule : rules) {
            OverrideOutcome outcome = rule.evaluate(signals);
            if (outcome.isForcedNonMatch()) {
                log.debug("override.veto rule={} signals={}", rule.name(), signals);
                return outcome;
            }
            if (outcome.isForcedMatch() && firstMatch == null) {
                firstMatch = outcome;
            }
        }
        return firstMatch != null ? firstMatch : OverrideOutcome.noOverride();
    }

    public List<OverrideRule> getRules() {
        return rules;
    }
}
