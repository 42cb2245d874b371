package com.rugradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, capped at {@code maxDelayMs}.
 * Shared by HTTP RPC retries and WebSocket reconnects.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.min(Math.max(0.0, jitterFactor), 1.0);
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
    }

    /**
     * Delay in milliseconds before the retry that follows the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then ± jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Default: 500ms base, ±20% jitter, 3 attempts, 30s cap.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3, 30_000L);
    }
}
