package com.mercadolibre.ratelimiter.ratelimit.core;

/**
 * Immutable limiting policy attached to a route.
 *
 * @param limit         permits per window
 * @param window        window length in seconds
 * @param burst         token bucket capacity
 * @param blockDuration seconds reported as retry-after for deny-listed callers
 * @param enabled       whether the route is limited at all
 */
public record RateLimitConfig(int limit, int window, int burst, int blockDuration, boolean enabled) {

    public static final int DEFAULT_BURST = 10;
    public static final int DEFAULT_BLOCK_DURATION = 60;

    public RateLimitConfig {
        if (limit < 1) throw new IllegalArgumentException("limit must be > 0, got " + limit);
        if (window < 1) throw new IllegalArgumentException("window must be > 0, got " + window);
        if (burst < 1) throw new IllegalArgumentException("burst must be > 0, got " + burst);
        if (blockDuration < 1) throw new IllegalArgumentException("blockDuration must be > 0, got " + blockDuration);
    }

    public static RateLimitConfig of(int limit, int window) {
        return new RateLimitConfig(limit, window, DEFAULT_BURST, DEFAULT_BLOCK_DURATION, true);
    }

    public static RateLimitConfig of(int limit, int window, int burst) {
        return new RateLimitConfig(limit, window, burst, DEFAULT_BLOCK_DURATION, true);
    }

    /** Tokens regenerated per second by the token bucket. */
    public double refillPerSecond() {
        return (double) limit / window;
    }

    public RateLimitConfig disabled() {
        return new RateLimitConfig(limit, window, burst, blockDuration, false);
    }
}
