package com.mercadolibre.ratelimiter.ratelimit.redis;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Redis-backed store. The compound operations run as Lua scripts, so each one is atomic on the server
 * and consistent across every instance sharing the Redis.
 */
public class RedisRateLimitStore implements RateLimitStore {

    /**
     * KEYS = keys to write, ARGV[1] = ttl seconds (0 = none),
     * ARGV[2..n+1] = expected ("0" absent, "1" + value present), ARGV[n+2..2n+1] = new values.
     */
    static final String COMPARE_AND_SET = String.join("\n",
            "local n = #KEYS",
            "local ttl = tonumber(ARGV[1])",
            "for i = 1, n do",
            "  local current = redis.call('GET', KEYS[i])",
            "  local expected = ARGV[1 + i]",
            "  if expected == '0' then",
            "    if current then return 0 end",
            "  elseif current ~= string.sub(expected, 2) then",
            "    return 0",
            "  end",
            "end",
            "for i = 1, n do",
            "  if ttl > 0 then",
            "    redis.call('SET', KEYS[i], ARGV[1 + n + i], 'EX', ttl)",
            "  else",
            "    redis.call('SET', KEYS[i], ARGV[1 + n + i])",
            "  end",
            "end",
            "return 1"
    );

    /** ARGV[1] = limit, ARGV[2] = ttl seconds. Returns the new count or -1 when at the limit. */
    static final String INCREMENT_IF_BELOW = String.join("\n",
            "local current = tonumber(redis.call('GET', KEYS[1]) or '0')",
            "if current >= tonumber(ARGV[1]) then",
            "  return -1",
            "end",
            "local next = redis.call('INCR', KEYS[1])",
            "if next == 1 then",
            "  redis.call('EXPIRE', KEYS[1], ARGV[2])",
            "end",
            "return next"
    );

    /** ARGV = pruneUpTo, limit, member, score, ttl seconds. Returns 1 when added. */
    static final String ZADD_IF_BELOW = String.join("\n",
            "redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', ARGV[1])",
            "if redis.call('ZCARD', KEYS[1]) >= tonumber(ARGV[2]) then",
            "  return 0",
            "end",
            "redis.call('ZADD', KEYS[1], ARGV[4], ARGV[3])",
            "redis.call('EXPIRE', KEYS[1], ARGV[5])",
            "return 1"
    );

    private static final long SCAN_COUNT = 500;

    private final ReactiveStringRedisTemplate redis;
    private final DefaultRedisScript<Long> compareAndSet = new DefaultRedisScript<>(COMPARE_AND_SET, Long.class);
    private final DefaultRedisScript<Long> incrementIfBelow = new DefaultRedisScript<>(INCREMENT_IF_BELOW, Long.class);
    private final DefaultRedisScript<Long> zAddIfBelow = new DefaultRedisScript<>(ZADD_IF_BELOW, Long.class);

    public RedisRateLimitStore(ReactiveStringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Mono<String> get(String key) {
        return redis.opsForValue().get(key);
    }

    @Override
    public Mono<List<String>> multiGet(List<String> keys) {
        return redis.opsForValue().multiGet(keys);
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        return ttl == null
                ? redis.opsForValue().set(key, value)
                : redis.opsForValue().set(key, value, Duration.ofSeconds(RateLimitStore.ttlSeconds(ttl)));
    }

    @Override
    public Mono<Boolean> multiSet(Map<String, String> values, Duration ttl) {
        Mono<Boolean> write = redis.opsForValue().multiSet(values);
        if (ttl == null) return write;
        return write.flatMap(ok -> Flux.fromIterable(values.keySet())
                .flatMap(k -> expire(k, ttl))
                .then(Mono.just(ok)));
    }

    @Override
    public Mono<Long> increment(String key) {
        return redis.opsForValue().increment(key);
    }

    @Override
    public Mono<Boolean> expire(String key, Duration ttl) {
        return redis.expire(key, Duration.ofSeconds(RateLimitStore.ttlSeconds(ttl)));
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return redis.hasKey(key);
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return redis.delete(key).map(n -> n > 0);
    }

    @Override
    public Mono<Long> ttl(String key) {
        ByteBuffer k = ByteBuffer.wrap(key.getBytes(StandardCharsets.UTF_8));
        return redis.execute(conn -> conn.keyCommands().ttl(k)).next();
    }

    @Override
    public Flux<String> keys(String pattern) {
        return redis.scan(ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build());
    }

    @Override
    public Mono<Boolean> zAdd(String key, String member, double score) {
        return redis.opsForZSet().add(key, member, score);
    }

    @Override
    public Flux<ScoredMember> zRangeWithScores(String key, long start, long end) {
        return redis.opsForZSet().rangeWithScores(key, Range.closed(start, end))
                .map(t -> new ScoredMember(t.getValue(), t.getScore() != null ? t.getScore() : 0d));
    }

    @Override
    public Mono<Long> zRemoveRangeByScore(String key, double min, double max) {
        return redis.opsForZSet().removeRangeByScore(key, Range.closed(min, max));
    }

    @Override
    public Mono<Long> zCard(String key) {
        return redis.opsForZSet().size(key);
    }

    @Override
    public Mono<Boolean> compareAndSet(List<String> keys, List<String> expected, List<String> updates, Duration ttl) {
        if (keys.size() != expected.size() || keys.size() != updates.size()) {
            return Mono.error(new IllegalArgumentException("keys, expected and updates must have the same size"));
        }
        List<String> args = new ArrayList<>(1 + 2 * keys.size());
        args.add(ttl == null ? "0" : String.valueOf(RateLimitStore.ttlSeconds(ttl)));
        for (String e : expected) {
            args.add(e == null ? "0" : "1" + e);
        }
        args.addAll(updates);
        return redis.execute(compareAndSet, keys, args)
                .single()
                .map(res -> res == 1L);
    }

    @Override
    public Mono<Long> incrementIfBelow(String key, long limit, Duration ttl) {
        return redis.execute(incrementIfBelow, List.of(key),
                        List.of(String.valueOf(limit), String.valueOf(RateLimitStore.ttlSeconds(ttl))))
                .single();
    }

    @Override
    public Mono<Boolean> zAddIfBelow(String key, double pruneUpTo, long limit, String member, double score, Duration ttl) {
        List<String> args = List.of(
                String.valueOf(pruneUpTo),
                String.valueOf(limit),
                member,
                String.valueOf(score),
                String.valueOf(RateLimitStore.ttlSeconds(ttl)));
        return redis.execute(zAddIfBelow, List.of(key), args)
                .single()
                .map(res -> res == 1L);
    }
}
