package com.mercadolibre.ratelimiter.ratelimit.algorithm;

import com.mercadolibre.ratelimiter.ratelimit.core.AlgorithmType;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * One counter per aligned window: {@code rate_limit:counter:<key>:<windowStart>}.
 * Up to {@code 2 * limit} requests can pass around a window edge; that is accepted.
 */
public class FixedWindow extends AbstractRateLimitAlgorithm {

    static final String COUNTER_NS = "counter";

    public FixedWindow(RateLimitStore store, Clock clock) {
        super(store, clock);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.FIXED_WINDOW;
    }

    @Override
    public Mono<Boolean> isAllowed(String key, RateLimitConfig config) {
        return Mono.defer(() -> store.incrementIfBelow(counterKey(key, windowStart(config)), config.limit(),
                        Duration.ofSeconds(config.window() + 1L)))
                .map(count -> count > 0)
                .onErrorResume(e -> allowOnError(e, "check", key));
    }

    @Override
    public Mono<Integer> getRemaining(String key, RateLimitConfig config) {
        return Mono.defer(() -> store.get(counterKey(key, windowStart(config))))
                .map(Long::parseLong)
                .defaultIfEmpty(0L)
                .map(count -> clamp(config.limit() - count, config))
                .onErrorResume(e -> limitOnError(e, key, config));
    }

    @Override
    public Mono<Long> getResetTime(String key, RateLimitConfig config) {
        return Mono.fromSupplier(() -> windowStart(config) + config.window());
    }

    long windowStart(RateLimitConfig config) {
        return Math.floorDiv(nowSeconds(), config.window()) * config.window();
    }

    static String counterKey(String key, long windowStart) {
        return namespaced(COUNTER_NS, key) + ":" + windowStart;
    }
}
