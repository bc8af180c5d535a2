package com.launchradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Capped exponential backoff: {@code min(baseDelay * 2^min(attempt, maxExponent), maxDelay)}, with optional
 * ±jitter applied after the cap. The named factories are the three policies used by ingestion and are kept
 * separate on purpose: RPC retries, socket reconnects and connection-creation rate-limit cool-downs.
 */
public final class BackoffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int maxExponent;
    private final double jitterFactor;
    private final int maxAttempts;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, int maxExponent, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Invalid delays: base=" + baseDelayMs + " max=" + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxExponent = Math.max(0, Math.min(maxExponent, 30));
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     */
    public long delayMs(int attempt) {
        int exponent = Math.min(Math.max(attempt, 0), maxExponent);
        long exponential = baseDelayMs * (1L << exponent);
        return jitter(Math.min(exponential, maxDelayMs));
    }

    /**
     * True when another attempt with this zero-based index may still be scheduled.
     */
    public boolean allowsAttempt(int attempt) {
        return attempt >= 0 && attempt < maxAttempts;
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * RPC call retries: 1s base, ±20% jitter, 3 attempts.
     */
    public static BackoffPolicy rpcRetry() {
        return new BackoffPolicy(1_000L, 30_000L, 20, 0.2, 3);
    }

    /**
     * Socket reconnect after an abnormal close: {@code min(2000 * 2^n, 60000)} ms for n in [0, 9].
     */
    public static BackoffPolicy socketReconnect() {
        return new BackoffPolicy(2_000L, 60_000L, 30, 0, 10);
    }

    /**
     * Connection-creation cool-down after a rate-limit signal: {@code min(180000 * 2^min(c, 6), 3600000)} ms.
     * Unbounded attempts; the counter only grows the window.
     */
    public static BackoffPolicy connectionRateLimit() {
        return new BackoffPolicy(180_000L, 3_600_000L, 6, 0, Integer.MAX_VALUE);
    }
}
