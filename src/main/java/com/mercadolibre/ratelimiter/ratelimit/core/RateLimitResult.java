package com.mercadolibre.ratelimiter.ratelimit.core;

import java.util.Optional;

/**
 * Outcome of one limiter check. {@code retryAfter} is set only when the request was denied.
 */
public record RateLimitResult(boolean allowed, int remaining, long resetTime, int limit, Integer retryAfter) {

    /** Remaining/limit reported when a request bypasses limiting. */
    public static final int UNLIMITED = 999_999;
    private static final long UNLIMITED_RESET_SECONDS = 3600;

    public RateLimitResult {
        if (remaining < 0) remaining = 0;
        if (allowed && retryAfter != null) {
            throw new IllegalArgumentException("retryAfter is only valid for denied results");
        }
        if (!allowed && retryAfter == null) {
            throw new IllegalArgumentException("denied results need a retryAfter");
        }
    }

    public static RateLimitResult unlimited(long now) {
        return new RateLimitResult(true, UNLIMITED, now + UNLIMITED_RESET_SECONDS, UNLIMITED, null);
    }

    public static RateLimitResult allowed(int remaining, long resetTime, int limit) {
        return new RateLimitResult(true, remaining, resetTime, limit, null);
    }

    public static RateLimitResult denied(int remaining, long resetTime, int limit, int retryAfter) {
        return new RateLimitResult(false, remaining, resetTime, limit, Math.max(0, retryAfter));
    }

    public Optional<Integer> retryAfterOpt() { return Optional.ofNullable(retryAfter); }

    public long resetAfter(long now) {
        return Math.max(0, resetTime - now);
    }
}
