package com.incident.dedup.similarity;

import java.math.BigDecimal;

/**
 * Exact IMO-number match: 1 iff both are present and equal as strings, else 0.
 * Numeric IMO values are stringified before comparison, so {@code "9123456"} matches {@code 9123456}.
 */
public class ImoSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String imo1, String imo2) {
        return compare(imo1, imo2);
    }

    /**
     * Compares IMO values of any type (string or number).
     */
    public double compare(Object imo1, Object imo2) {
        String normalized1 = toImoString(imo1);
        String normalized2 = toImoString(imo2);
        if (normalized1 == null || normalized2 == null) {
            return 0.0;
        }
        return normalized1.equals(normalized2) ? 1.0 : 0.0;
    }

    @Override
    public String getName() {
        return "IMO";
    }

    /**
     * String form of an IMO value; integral numbers lose any decimal suffix.
     * Returns null for null or blank values.
     */
    public static String toImoString(Object imo) {
        if (imo == null) {
            return null;
        }
        String text;
        if (imo instanceof BigDecimal decimal) {
            text = decimal.stripTrailingZeros().toPlainString();
        } else if (imo instanceof Double || imo instanceof Float) {
            double value = ((Number) imo).doubleValue();
            text = value == Math.rint(value) && !Double.isInfinite(value)
                    ? Long.toString((long) value)
                    : Double.toString(value);
        } else {
            text = imo.toString();
        }
        text = text.trim();
        return text.isEmpty() ? null : text;
    }
}
