package com.incident.dedup.similarity;

/**
 * Levenshtein distance-based similarity.
 * Computes similarity as 1 - (edit_distance / max_length), floored at 0.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int maxLength = Math.max(s1.length(), s2.length());
        int distance = distance(s1, s2);
        return Math.max(0.0, 1.0 - ((double) distance / maxLength));
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Standard edit distance over the full (|a|+1)·(|b|+1) dynamic-programming table.
     */
    public static int distance(String a, String b) {
        int m = a.length();
        int n = b.length();
        int[][] table = new int[m + 1][n + 1];

        for (int i = 0; i <= m; i++) {
            table[i][0] = i;
        }
        for (int j = 0; j <= n; j++) {
            table[0][j] = j;
        }

        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                table[i][j] = Math.min(
                        Math.min(table[i - 1][j] + 1, table[i][j - 1] + 1),
                        table[i - 1][j - 1] + cost
                );
            }
        }

        return table[m][n];
    }
}
