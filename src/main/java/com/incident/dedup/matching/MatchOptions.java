package com.incident.dedup.matching;

/**
 * Options for ingest-time candidate matching.
 */
public class MatchOptions {

    public static final double DEFAULT_WINDOW_HOURS = 48.0;
    public static final double DEFAULT_MAX_DISTANCE_KM = 50.0;
    public static final double DEFAULT_MATCH_THRESHOLD = 0.75;

    private final double windowHours;
    private final double maxDistanceKm;
    private final double matchThreshold;

    private MatchOptions(Builder builder) {
        this.windowHours = builder.windowHours;
        this.maxDistanceKm = builder.maxDistanceKm;
        this.matchThreshold = builder.matchThreshold;
    }

    /**
     * Half-width of the candidate time window, also the time-proximity decay window.
     */
    public double getWindowHours() {
        return windowHours;
    }

    /**
     * Distance budget of the candidate bounding box, also the spatial decay window.
     */
    public double getMaxDistanceKm() {
        return maxDistanceKm;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public static MatchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double windowHours = DEFAULT_WINDOW_HOURS;
        private double maxDistanceKm = DEFAULT_MAX_DISTANCE_KM;
        private double matchThreshold = DEFAULT_MATCH_THRESHOLD;

        public Builder windowHours(double windowHours) {
            if (windowHours <= 0) {
                throw new IllegalArgumentException("windowHours must be positive");
            }
            this.windowHours = windowHours;
            return this;
        }

        public Builder maxDistanceKm(double maxDistanceKm) {
            if (maxDistanceKm <= 0) {
                throw new IllegalArgumentException("maxDistanceKm must be positive");
            }
            this.maxDistanceKm = maxDistanceKm;
            return this;
        }

        public Builder matchThreshold(double matchThreshold) {
            if (matchThreshold < 0.0 || matchThreshold > 1.0) {
                throw new IllegalArgumentException("matchThreshold must be between 0.0 and 1.0");
            }
            this.matchThreshold = matchThreshold;
            return this;
        }

        public MatchOptions build() {
            return new MatchOptions(this);
        }
    }
}
