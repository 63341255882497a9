package com.incident.dedup.core.model;

/**
 * Machine-readable reason why a pair was scored 0 without computing identity components.
 */
public enum ScoreRejection {
    MISSING_DATE("Missing date field"),
    INVALID_COORDINATES("Missing or invalid coordinates"),
    TIME_OUT_OF_WINDOW("Time difference too large"),
    DISTANCE_OUT_OF_WINDOW("Spatial distance too large");

    private final String description;

    ScoreRejection(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
