package com.mercadolibre.ratelimiter.ratelimit.core;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Key-value store holding all limiter state. Shared by every service instance.
 *
 * <p>A {@code null} ttl means the key never expires. TTLs are applied in whole seconds.
 * The compound operations at the bottom must be atomic per call; the algorithms rely on them
 * for their read-modify-write sequences.
 */
public interface RateLimitStore {

    long TTL_NO_EXPIRY = -1;
    long TTL_MISSING = -2;

    /** Empty when the key is absent. */
    Mono<String> get(String key);

    /** One slot per key, {@code null} where the key is absent. */
    Mono<List<String>> multiGet(List<String> keys);

    Mono<Boolean> set(String key, String value, Duration ttl);

    Mono<Boolean> multiSet(Map<String, String> values, Duration ttl);

    Mono<Long> increment(String key);

    Mono<Boolean> expire(String key, Duration ttl);

    Mono<Boolean> exists(String key);

    /** True when a key was actually removed. */
    Mono<Boolean> delete(String key);

    /** Remaining ttl in seconds, {@link #TTL_NO_EXPIRY} or {@link #TTL_MISSING}. */
    Mono<Long> ttl(String key);

    /** Keys matching a glob pattern ({@code *} wildcard). */
    Flux<String> keys(String pattern);

    Mono<Boolean> zAdd(String key, String member, double score);

    /** Members ordered by ascending score, ranks inclusive, negative ranks count from the end. */
    Flux<ScoredMember> zRangeWithScores(String key, long start, long end);

    /** Removes members with {@code min <= score <= max}. */
    Mono<Long> zRemoveRangeByScore(String key, double min, double max);

    Mono<Long> zCard(String key);

    // atomic compound operations

    /**
     * Writes every {@code updates[i]} to {@code keys[i]} iff each key currently holds {@code expected[i]}
     * ({@code null} meaning absent). Returns false and writes nothing otherwise.
     */
    Mono<Boolean> compareAndSet(List<String> keys, List<String> expected, List<String> updates, Duration ttl);

    /**
     * Increments the counter iff its current value is below {@code limit}. Returns the new value,
     * or {@code -1} when the limit was already reached. The ttl is set when the counter is created.
     */
    Mono<Long> incrementIfBelow(String key, long limit, Duration ttl);

    /**
     * Drops members scored {@code <= pruneUpTo}, then adds {@code member} iff fewer than {@code limit}
     * remain. The ttl is refreshed on add.
     */
    Mono<Boolean> zAddIfBelow(String key, double pruneUpTo, long limit, String member, double score, Duration ttl);

    record ScoredMember(String member, double score) {}

    static long ttlSeconds(Duration ttl) {
        return Math.max(1, ttl.getSeconds());
    }
}
