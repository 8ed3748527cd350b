package com.mercadolibre.ratelimiter.ratelimit.algorithm;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;

import java.util.List;

/**
 * Stored bucket: token count and the last refill instant in epoch seconds.
 */
record TokenBucketState(double tokens, double lastRefill) {

    /** Reads the {@code [tokens, lastRefill]} pair; a missing value starts a full bucket at {@code now}. */
    static TokenBucketState read(List<String> raw, RateLimitConfig config, double now) {
        String t = raw.size() > 0 ? raw.get(0) : null;
        String l = raw.size() > 1 ? raw.get(1) : null;
        double tokens = t != null ? Double.parseDouble(t) : config.burst();
        double last = l != null ? Double.parseDouble(l) : now;
        return new TokenBucketState(tokens, last);
    }

    /** Tokens available at {@code now}, capped at the burst size. */
    TokenBucketState refill(double now, RateLimitConfig config) {
        double elapsed = Math.max(0, now - lastRefill);
        double refilled = Math.min(config.burst(), tokens + elapsed * config.limit() / config.window());
        return new TokenBucketState(refilled, now);
    }

    TokenBucketState consume() {
        return new TokenBucketState(tokens - 1, lastRefill);
    }

    boolean hasToken() {
        return tokens >= 1;
    }

    List<String> encode() {
        return List.of(Double.toString(tokens), Double.toString(lastRefill));
    }
}
