package com.incident.dedup.dedup;

import java.time.Duration;

/**
 * Options for one batch deduplication pass.
 */
public class DeduplicationOptions {

    public static final Duration DEFAULT_LOOKBACK = Duration.ofDays(30);
    public static final int DEFAULT_MAX_RECORDS = 500;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.70;
    public static final double DEFAULT_HIGH_CONFIDENCE_THRESHOLD = 0.80;
    public static final String DEFAULT_TRIGGERED_BY = "dedup-batch";

    private final Duration lookback;
    private final int maxRecords;
    private final double confidenceThreshold;
    private final double highConfidenceThreshold;
    private final boolean dryRun;
    private final String triggeredBy;

    private DeduplicationOptions(Builder builder) {
        this.lookback = builder.lookback;
        this.maxRecords = builder.maxRecords;
        this.confidenceThreshold = builder.confidenceThreshold;
        this.highConfidenceThreshold = builder.highConfidenceThreshold;
        this.dryRun = builder.dryRun;
        this.triggeredBy = builder.triggeredBy;
    }

    public Duration getLookback() {
        return lookback;
    }

    public int getMaxRecords() {
        return maxRecords;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    /**
     * Reporting label only; pairs above it follow the same merge path.
     */
    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    public static DeduplicationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration lookback = DEFAULT_LOOKBACK;
        private int maxRecords = DEFAULT_MAX_RECORDS;
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private double highConfidenceThreshold = DEFAULT_HIGH_CONFIDENCE_THRESHOLD;
        private boolean dryRun = false;
        private String triggeredBy = DEFAULT_TRIGGERED_BY;

        public Builder lookback(Duration lookback) {
            if (lookback == null || lookback.isNegative() || lookback.isZero()) {
                throw new IllegalArgumentException("lookback must be positive");
            }
            this.lookback = lookback;
            return this;
        }

        public Builder lookbackDays(int days) {
            return lookback(Duration.ofDays(days));
        }

        public Builder maxRecords(int maxRecords) {
            if (maxRecords <= 0) {
                throw new IllegalArgumentException("maxRecords must be positive");
            }
            this.maxRecords = maxRecords;
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            validateThreshold(confidenceThreshold, "confidenceThreshold");
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder highConfidenceThreshold(double highConfidenceThreshold) {
            validateThreshold(highConfidenceThreshold, "highConfidenceThreshold");
            this.highConfidenceThreshold = highConfidenceThreshold;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public DeduplicationOptions build() {
            if (highConfidenceThreshold < confidenceThreshold) {
                throw new IllegalArgumentException(
                        "highConfidenceThreshold must be >= confidenceThreshold");
            }
            return new DeduplicationOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
