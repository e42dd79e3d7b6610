package com.sunorcnys.http;

import java.time.Duration;

/**
 * Bounds for retrying a single request.
 *
 * @param baseDelay           first rate-limit delay, doubled per attempt
 * @param maxDelay            cap for any single delay, provider hints included
 * @param maxRateLimitRetries retries after HTTP 429
 * @param maxTransportRetries retries after I/O failures or 5xx
 * @param transportDelay      fixed delay between transport retries
 * @param maxElapsed          total time budget for one request including all retries
 */
public record RetryPolicy(
        Duration baseDelay,
        Duration maxDelay,
        int maxRateLimitRetries,
        int maxTransportRetries,
        Duration transportDelay,
        Duration maxElapsed
) {

    public RetryPolicy {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (maxRateLimitRetries < 0 || maxTransportRetries < 0) {
            throw new IllegalArgumentException("retry counts must be >= 0");
        }
        if (transportDelay == null || transportDelay.isNegative()) {
            throw new IllegalArgumentException("transportDelay must be >= 0");
        }
        if (maxElapsed == null || maxElapsed.isNegative() || maxElapsed.isZero()) {
            throw new IllegalArgumentException("maxElapsed must be > 0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 5, 3,
                Duration.ofMillis(500), Duration.ofMinutes(5));
    }

    /**
     * Delay before rate-limit retry number {@code attempt} (1-based). A provider hint wins but is still capped.
     */
    public Duration rateLimitDelay(int attempt, Duration hint) {
        if (hint != null && !hint.isNegative()) {
            return min(hint, maxDelay);
        }
        int shift = Math.min(Math.max(attempt, 1) - 1, 30);
        long millis = baseDelay.toMillis() * (1L << shift);
        return min(Duration.ofMillis(millis), maxDelay);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
