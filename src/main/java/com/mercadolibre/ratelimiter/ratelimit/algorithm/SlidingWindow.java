package com.mercadolibre.ratelimiter.ratelimit.algorithm;

import com.mercadolibre.ratelimiter.ratelimit.core.AlgorithmType;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Exact sliding log: one sorted-set member per admitted request, scored by its timestamp.
 * Members carry a random suffix so two requests in the same millisecond are both counted.
 */
public class SlidingWindow extends AbstractRateLimitAlgorithm {

    static final String REQUESTS_NS = "requests";

    public SlidingWindow(RateLimitStore store, Clock clock) {
        super(store, clock);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.SLIDING_WINDOW;
    }

    @Override
    public Mono<Boolean> isAllowed(String key, RateLimitConfig config) {
        return Mono.defer(() -> {
                    double now = now();
                    String member = now + "-" + UUID.randomUUID();
                    return store.zAddIfBelow(requestsKey(key), now - config.window(), config.limit(),
                            member, now, Duration.ofSeconds(config.window() + 1L));
                })
                .onErrorResume(e -> allowOnError(e, "check", key));
    }

    @Override
    public Mono<Integer> getRemaining(String key, RateLimitConfig config) {
        String k = requestsKey(key);
        return Mono.defer(() -> store.zRemoveRangeByScore(k, 0, now() - config.window()))
                .then(store.zCard(k))
                .map(count -> clamp(config.limit() - count, config))
                .onErrorResume(e -> limitOnError(e, key, config));
    }

    /**
     * Oldest surviving request plus the window, rounded up to the next whole second so a client that
     * waits until then finds the entry gone. A full window from now when nothing is logged.
     */
    @Override
    public Mono<Long> getResetTime(String key, RateLimitConfig config) {
        return store.zRangeWithScores(requestsKey(key), 0, 0)
                .next()
                .map(oldest -> (long) Math.ceil(oldest.score() + config.window()))
                .switchIfEmpty(Mono.fromSupplier(() -> (long) Math.ceil(now() + config.window())))
                .onErrorResume(e -> windowOnError(e, key, config));
    }

    static String requestsKey(String key) {
        return namespaced(REQUESTS_NS, key);
    }
}
