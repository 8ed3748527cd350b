package com.mercadolibre.ratelimiter.application;

import com.mercadolibre.ratelimiter.ratelimit.core.AlgorithmType;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;

import java.util.Objects;

/**
 * Limiter-wide switches, fixed at construction.
 *
 * @param storage informational: the backend in use ({@code memory} or {@code redis})
 */
public record RateLimiterSettings(
        boolean enabled,
        AlgorithmType defaultAlgorithm,
        boolean allowListEnabled,
        boolean denyListEnabled,
        boolean logViolations,
        String storage,
        RateLimitConfig defaultConfig
) {
    public RateLimiterSettings {
        Objects.requireNonNull(defaultAlgorithm, "defaultAlgorithm");
        Objects.requireNonNull(defaultConfig, "defaultConfig");
    }

    public static RateLimiterSettings defaults() {
        return new RateLimiterSettings(true, AlgorithmType.TOKEN_BUCKET, true, true, true, "memory",
                RateLimitConfig.of(100, 60));
    }

    public RateLimiterSettings withEnabled(boolean value) {
        return new RateLimiterSettings(value, defaultAlgorithm, allowListEnabled, denyListEnabled, logViolations,
                storage, defaultConfig);
    }
}
