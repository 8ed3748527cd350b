package com.mercadolibre.ratelimiter.ratelimit.algorithm;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import com.mercadolibre.ratelimiter.ratelimit.core.ScopeKeyBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;

abstract class AbstractRateLimitAlgorithm implements RateLimitAlgorithm {

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final RateLimitStore store;
    protected final Clock clock;

    protected AbstractRateLimitAlgorithm(RateLimitStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /** Seconds since the epoch, with millisecond precision. */
    protected double now() {
        return clock.millis() / 1000.0;
    }

    protected long nowSeconds() {
        return clock.millis() / 1000;
    }

    protected static String namespaced(String namespace, String key) {
        return ScopeKeyBuilder.PREFIX + ScopeKeyBuilder.DELIMITER + namespace + ScopeKeyBuilder.DELIMITER + key;
    }

    protected static int clamp(long remaining, RateLimitConfig config) {
        return (int) Math.max(0, Math.min(config.limit(), remaining));
    }

    protected Mono<Boolean> allowOnError(Throwable e, String op, String key) {
        log.error("{} {} failed for key={}, allowing request: {}", type().id(), op, key, e.toString());
        return Mono.just(true);
    }

    protected Mono<Integer> limitOnError(Throwable e, String key, RateLimitConfig config) {
        log.error("{} remaining lookup failed for key={}: {}", type().id(), key, e.toString());
        return Mono.just(config.limit());
    }

    protected Mono<Long> windowOnError(Throwable e, String key, RateLimitConfig config) {
        log.error("{} reset lookup failed for key={}: {}", type().id(), key, e.toString());
        return Mono.just(nowSeconds() + config.window());
    }
}
