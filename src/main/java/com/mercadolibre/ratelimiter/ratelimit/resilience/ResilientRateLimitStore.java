package com.mercadolibre.ratelimiter.ratelimit.resilience;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Bounds every store call with a time limiter and a circuit breaker. Failures still reach the caller
 * as errors; the algorithms turn them into fail-open decisions.
 */
public class ResilientRateLimitStore implements RateLimitStore {

    private final RateLimitStore delegate;
    private final CircuitBreaker cb;
    private final TimeLimiter tl;

    public ResilientRateLimitStore(RateLimitStore delegate, CircuitBreaker cb, TimeLimiter tl) {
        this.delegate = delegate;
        this.cb = cb;
        this.tl = tl;
    }

    @Override
    public Mono<String> get(String key) {
        return guard(delegate.get(key));
    }

    @Override
    public Mono<List<String>> multiGet(List<String> keys) {
        return guard(delegate.multiGet(keys));
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        return guard(delegate.set(key, value, ttl));
    }

    @Override
    public Mono<Boolean> multiSet(Map<String, String> values, Duration ttl) {
        return guard(delegate.multiSet(values, ttl));
    }

    @Override
    public Mono<Long> increment(String key) {
        return guard(delegate.increment(key));
    }

    @Override
    public Mono<Boolean> expire(String key, Duration ttl) {
        return guard(delegate.expire(key, ttl));
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return guard(delegate.exists(key));
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return guard(delegate.delete(key));
    }

    @Override
    public Mono<Long> ttl(String key) {
        return guard(delegate.ttl(key));
    }

    @Override
    public Flux<String> keys(String pattern) {
        return guard(delegate.keys(pattern));
    }

    @Override
    public Mono<Boolean> zAdd(String key, String member, double score) {
        return guard(delegate.zAdd(key, member, score));
    }

    @Override
    public Flux<ScoredMember> zRangeWithScores(String key, long start, long end) {
        return guard(delegate.zRangeWithScores(key, start, end));
    }

    @Override
    public Mono<Long> zRemoveRangeByScore(String key, double min, double max) {
        return guard(delegate.zRemoveRangeByScore(key, min, max));
    }

    @Override
    public Mono<Long> zCard(String key) {
        return guard(delegate.zCard(key));
    }

    @Override
    public Mono<Boolean> compareAndSet(List<String> keys, List<String> expected, List<String> updates, Duration ttl) {
        return guard(delegate.compareAndSet(keys, expected, updates, ttl));
    }

    @Override
    public Mono<Long> incrementIfBelow(String key, long limit, Duration ttl) {
        return guard(delegate.incrementIfBelow(key, limit, ttl));
    }

    @Override
    public Mono<Boolean> zAddIfBelow(String key, double pruneUpTo, long limit, String member, double score, Duration ttl) {
        return guard(delegate.zAddIfBelow(key, pruneUpTo, limit, member, score, ttl));
    }

    private <T> Mono<T> guard(Mono<T> mono) {
        return mono
                .transformDeferred(TimeLimiterOperator.of(tl))
                .transformDeferred(CircuitBreakerOperator.of(cb));
    }

    private <T> Flux<T> guard(Flux<T> flux) {
        return flux
                .transformDeferred(TimeLimiterOperator.of(tl))
                .transformDeferred(CircuitBreakerOperator.of(cb));
    }
}
