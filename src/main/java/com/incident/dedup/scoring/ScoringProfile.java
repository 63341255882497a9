package com.incident.dedup.scoring;

/**
 * Proximity windows and weights used by one pipeline.
 *
 * @param maxHours time window for linear time-proximity decay
 * @param maxKm    distance window for linear spatial-proximity decay
 * @param weights  component weights
 */
public record ScoringProfile(double maxHours, double maxKm, ScoringWeights weights) {

    public static final double DEFAULT_MAX_HOURS = 48.0;
    public static final double DEFAULT_MAX_KM = 50.0;

    public ScoringProfile {
        if (maxHours <= 0) {
            throw new IllegalArgumentException("maxHours must be positive");
        }
        if (maxKm <= 0) {
            throw new IllegalArgumentException("maxKm must be positive");
        }
        if (weights == null) {
            throw new IllegalArgumentException("weights are required");
        }
    }

    /**
     * Profile of the batch deduplication pass: vessel identity weighs more than incident type.
     */
    public static ScoringProfile batch() {
        return new ScoringProfile(DEFAULT_MAX_HOURS, DEFAULT_MAX_KM,
                new ScoringWeights(0.40, 0.40, 0.15, 0.05));
    }

    /**
     * Profile of ingest-time candidate matching.
     */
    public static ScoringProfile ingest() {
        return new ScoringProfile(DEFAULT_MAX_HOURS, DEFAULT_MAX_KM,
                new ScoringWeights(0.40, 0.40, 0.10, 0.10));
    }

    public ScoringProfile withWindows(double hours, double km) {
        return new ScoringProfile(hours, km, weights);
    }
}
