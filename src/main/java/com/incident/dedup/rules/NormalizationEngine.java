package com.incident.dedup.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies normalization rules in priority order to an uppercased input.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(NormalizationRule::priority))
                .toList();
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Uppercases the input and applies every rule. Blank input normalizes to "".
     */
    public String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }

        String result = value.toUpperCase(Locale.ROOT);
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        return result.trim().replaceAll("\\s+", " ");
    }
}
