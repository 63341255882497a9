package com.incident.dedup.matching;

import com.incident.dedup.config.ReferenceDataLoader;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Named keyword lists (e.g. engine spares, mooring ropes) matched as whole words in report text.
 */
public class KeywordSignatures {

    private final Map<String, List<Pattern>> signatures;

    public KeywordSignatures(Map<String, List<String>> keywordsBySignature) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        keywordsBySignature.forEach((name, keywords) -> compiled.put(name, keywords.stream()
                .map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword.toUpperCase(Locale.ROOT)) + "\\b"))
                .toList()));
        this.signatures = Map.copyOf(compiled);
    }

    public static KeywordSignatures defaults() {
        return new KeywordSignatures(ReferenceDataLoader.loadDefaults().keywordSignatures());
    }

    /**
     * Signatures with at least one keyword present in the text.
     */
    public Set<String> signaturesIn(String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        signatures.forEach((name, patterns) -> {
            if (patterns.stream().anyMatch(p -> p.matcher(upper).find())) {
                found.add(name);
            }
        });
        return found;
    }

    public Set<String> shared(String text1, String text2) {
        Set<String> common = signaturesIn(text1);
        common.retainAll(signaturesIn(text2));
        return common;
    }
}
