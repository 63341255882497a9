package com.incident.dedup.scoring;

/**
 * Fixed weights of the composite score. Non-negative and summing to 1, so the weighted
 * total of components in [0,1] stays in [0,1].
 */
public record ScoringWeights(double time, double spatial, double vessel, double incidentType) {

    private static final double SUM_TOLERANCE = 1e-9;

    public ScoringWeights {
        if (time < 0 || spatial < 0 || vessel < 0 || incidentType < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = time + spatial + vessel + incidentType;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    public double combine(double timeScore, double spatialScore, double vesselScore, double typeScore) {
        return time * timeScore
                + spatial * spatialScore
                + vessel * vesselScore
                + incidentType * typeScore;
    }
}
