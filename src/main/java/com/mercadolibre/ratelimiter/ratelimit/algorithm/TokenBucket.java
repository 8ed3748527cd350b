package com.mercadolibre.ratelimiter.ratelimit.algorithm;

import com.mercadolibre.ratelimiter.ratelimit.core.AlgorithmType;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Continuous-refill token bucket. Capacity is {@code burst}; tokens come back at {@code limit / window}
 * per second.
 *
 * <p>State lives in two keys sharing a hash tag, so both fit one Redis Cluster slot:
 * {@code rate_limit:tokens:{key}} and {@code rate_limit:last_refill:{key}}. Updates are optimistic:
 * read, compute, then compare-and-set; a lost race is retried.
 */
public class TokenBucket extends AbstractRateLimitAlgorithm {

    static final String TOKENS_NS = "tokens";
    static final String LAST_REFILL_NS = "last_refill";
    static final int MAX_ATTEMPTS = 10;

    public TokenBucket(RateLimitStore store, Clock clock) {
        super(store, clock);
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.TOKEN_BUCKET;
    }

    @Override
    public Mono<Boolean> isAllowed(String key, RateLimitConfig config) {
        List<String> keys = keys(key);
        return Mono.defer(() -> attempt(key, keys, config))
                .retryWhen(Retry.max(MAX_ATTEMPTS - 1L).filter(ConcurrentUpdateException.class::isInstance))
                .onErrorResume(e -> allowOnError(e, "check", key));
    }

    @Override
    public Mono<Integer> getRemaining(String key, RateLimitConfig config) {
        return current(key, config)
                .map(s -> clamp((long) Math.floor(s.tokens()), config))
                .onErrorResume(e -> limitOnError(e, key, config));
    }

    /**
     * With less than one token left this is when the next one appears; otherwise when the bucket is full.
     */
    @Override
    public Mono<Long> getResetTime(String key, RateLimitConfig config) {
        return current(key, config)
                .map(s -> {
                    double target = s.hasToken() ? config.burst() : 1;
                    double seconds = Math.max(0, target - s.tokens()) * config.window() / config.limit();
                    return (long) Math.ceil(now() + seconds);
                })
                .onErrorResume(e -> windowOnError(e, key, config));
    }

    private Mono<Boolean> attempt(String key, List<String> keys, RateLimitConfig config) {
        return store.multiGet(keys).flatMap(raw -> {
            double now = now();
            TokenBucketState refilled = TokenBucketState.read(raw, config, now).refill(now, config);
            boolean allowed = refilled.hasToken();
            TokenBucketState next = allowed ? refilled.consume() : refilled;
            return store.compareAndSet(keys, raw, next.encode(), Duration.ofSeconds(2L * config.window()))
                    .flatMap(written -> written
                            ? Mono.just(allowed)
                            : Mono.error(new ConcurrentUpdateException(key)));
        });
    }

    private Mono<TokenBucketState> current(String key, RateLimitConfig config) {
        return store.multiGet(keys(key)).map(raw -> {
            double now = now();
            return TokenBucketState.read(raw, config, now).refill(now, config);
        });
    }

    static List<String> keys(String key) {
        String tagged = "{" + key + "}";
        return List.of(namespaced(TOKENS_NS, tagged), namespaced(LAST_REFILL_NS, tagged));
    }

    static final class ConcurrentUpdateException extends RuntimeException {
        ConcurrentUpdateException(String key) {
            super("concurrent update on token bucket " + key, null, false, false);
        }
    }
}
