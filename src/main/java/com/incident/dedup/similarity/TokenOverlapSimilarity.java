package com.incident.dedup.similarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Token overlap: the number of whitespace-delimited tokens of the first string that also
 * occur in the second, divided by the larger token count.
 */
public class TokenOverlapSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        List<String> tokens1 = tokenize(s1);
        List<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int matchCount = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                matchCount++;
            }
        }
        return (double) matchCount / Math.max(tokens1.size(), tokens2.size());
    }

    @Override
    public String getName() {
        return "TokenOverlap";
    }

    private List<String> tokenize(String s) {
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(s.trim().toUpperCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
