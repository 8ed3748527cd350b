package com.mercadolibre.ratelimiter.ratelimit.algorithm;

import com.mercadolibre.ratelimiter.ratelimit.core.AlgorithmType;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import reactor.core.publisher.Mono;

/**
 * A limiting algorithm evaluated against the shared store. Implementations never emit errors:
 * a failing store yields an allowed decision, {@code limit} remaining and a reset one window ahead.
 */
public interface RateLimitAlgorithm {

    AlgorithmType type();

    /** Consumes one permit if available. */
    Mono<Boolean> isAllowed(String key, RateLimitConfig config);

    /** Permits left, within {@code [0, limit]}. Does not consume. */
    Mono<Integer> getRemaining(String key, RateLimitConfig config);

    /** Unix seconds at which capacity returns. */
    Mono<Long> getResetTime(String key, RateLimitConfig config);
}
