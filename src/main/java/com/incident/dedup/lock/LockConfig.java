package com.incident.dedup.lock;

/**
 * Lock acquisition budget.
 *
 * @param timeoutMs    maximum wait per attempt
 * @param maxRetries   attempts after the first one
 * @param retryDelayMs pause between attempts
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
    }

    /**
     * 2s per attempt, 2 retries, 100ms between attempts.
     */
    public static LockConfig defaults() {
        return new LockConfig(2000, 2, 100);
    }
}
