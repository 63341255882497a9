package com.incident.dedup.core.model;

/**
 * Weighted similarity of two incident reports with every component exposed for debugging.
 *
 * <p>{@code vessel} is the combined vessel component (IMO match, name similarity, or the
 * neutral default); {@code vesselName} and {@code vesselImo} are the raw comparators.
 * {@code distanceKm} and {@code timeDeltaHours} are the raw measurements, infinite when
 * they could not be computed.</p>
 */
public record SimilarityScore(
        double total,
        double time,
        double spatial,
        double vessel,
        double vesselName,
        double vesselImo,
        double incidentType,
        double distanceKm,
        double timeDeltaHours,
        ScoreRejection rejection
) {
    public SimilarityScore {
        if (total < 0.0 || total > 1.0) {
            throw new IllegalArgumentException("total must be between 0.0 and 1.0, got " + total);
        }
    }

    /**
     * Creates a zero score carrying the reason the pair was short-circuited.
     */
    public static SimilarityScore rejected(ScoreRejection rejection, double distanceKm, double timeDeltaHours) {
        return new SimilarityScore(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
                distanceKm, timeDeltaHours, rejection);
    }

    public boolean isRejected() {
        return rejection != null;
    }

    /**
     * Human-readable rejection reason, or null for a computed score.
     */
    public String reason() {
        return rejection != null ? rejection.description() : null;
    }

    @Override
    public String toString() {
        if (rejection != null) {
            return "SimilarityScore{total=0, reason=" + rejection + '}';
        }
        return String.format(
                "SimilarityScore{total=%.4f, time=%.4f, spatial=%.4f, vessel=%.4f (name=%.4f, imo=%.0f), type=%.4f, km=%.2f, hours=%.2f}",
                total, time, spatial, vessel, vesselName, vesselImo, incidentType, distanceKm, timeDeltaHours);
    }
}
