package com.mercadolibre.ratelimiter.ratelimit.memory;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * Single-process store. Every operation runs under one lock, so the compound operations are atomic.
 * State is not shared between instances: use the Redis store for distributed deployments.
 *
 * <p>Expired keys are dropped when read, and a sweep over the whole map runs at most once per
 * {@link #SWEEP_INTERVAL}, piggybacked on whichever operation comes first after it is due.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final long NEVER = Long.MAX_VALUE;
    static final Duration SWEEP_INTERVAL = Duration.ofSeconds(30);

    private final Map<String, Entry> data = new HashMap<>();
    private final Object lock = new Object();
    private final Clock clock;
    private long nextSweepAt;

    public InMemoryRateLimitStore(Clock clock) {
        this.clock = clock;
        this.nextSweepAt = clock.millis() + SWEEP_INTERVAL.toMillis();
    }

    @Override
    public Mono<String> get(String key) {
        return locked(() -> {
            Entry e = live(key);
            return e == null ? null : e.string(key);
        });
    }

    @Override
    public Mono<List<String>> multiGet(List<String> keys) {
        return locked(() -> {
            List<String> out = new ArrayList<>(keys.size());
            for (String k : keys) {
                Entry e = live(k);
                out.add(e == null ? null : e.string(k));
            }
            return out;
        });
    }

    @Override
    public Mono<Boolean> set(String key, String value, Duration ttl) {
        return locked(() -> {
            data.put(key, Entry.ofString(value, expiry(ttl)));
            return true;
        });
    }

    @Override
    public Mono<Boolean> multiSet(Map<String, String> values, Duration ttl) {
        return locked(() -> {
            long exp = expiry(ttl);
            values.forEach((k, v) -> data.put(k, Entry.ofString(v, exp)));
            return true;
        });
    }

    @Override
    public Mono<Long> increment(String key) {
        return locked(() -> incr(key, NEVER));
    }

    @Override
    public Mono<Boolean> expire(String key, Duration ttl) {
        return locked(() -> {
            Entry e = live(key);
            if (e == null) return false;
            e.expiresAt = expiry(ttl);
            return true;
        });
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return locked(() -> live(key) != null);
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return locked(() -> live(key) != null && data.remove(key) != null);
    }

    @Override
    public Mono<Long> ttl(String key) {
        return locked(() -> {
            Entry e = live(key);
            if (e == null) return TTL_MISSING;
            if (e.expiresAt == NEVER) return TTL_NO_EXPIRY;
            long ms = e.expiresAt - clock.millis();
            return (ms + 999) / 1000;
        });
    }

    @Override
    public Flux<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        return this.<List<String>>locked(() -> {
            List<String> out = new ArrayList<>();
            for (String k : new ArrayList<>(data.keySet())) {
                if (live(k) != null && regex.matcher(k).matches()) out.add(k);
            }
            return out;
        }).flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Boolean> zAdd(String key, String member, double score) {
        return locked(() -> zset(key, true).put(member, score) == null);
    }

    @Override
    public Flux<ScoredMember> zRangeWithScores(String key, long start, long end) {
        return this.<List<ScoredMember>>locked(() -> {
            Map<String, Double> z = zset(key, false);
            if (z == null) return List.of();
            List<ScoredMember> sorted = sorted(z);
            int n = sorted.size();
            long from = start < 0 ? Math.max(0, n + start) : start;
            long to = end < 0 ? n + end : Math.min(end, n - 1L);
            if (from > to || from >= n) return List.of();
            return new ArrayList<>(sorted.subList((int) from, (int) to + 1));
        }).flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Long> zRemoveRangeByScore(String key, double min, double max) {
        return locked(() -> prune(key, min, max));
    }

    @Override
    public Mono<Long> zCard(String key) {
        return locked(() -> {
            Map<String, Double> z = zset(key, false);
            return z == null ? 0L : (long) z.size();
        });
    }

    @Override
    public Mono<Boolean> compareAndSet(List<String> keys, List<String> expected, List<String> updates, Duration ttl) {
        if (keys.size() != expected.size() || keys.size() != updates.size()) {
            return Mono.error(new IllegalArgumentException("keys, expected and updates must have the same size"));
        }
        return locked(() -> {
            for (int i = 0; i < keys.size(); i++) {
                Entry e = live(keys.get(i));
                String current = e == null ? null : e.string(keys.get(i));
                if (!Objects.equals(current, expected.get(i))) return false;
            }
            long exp = expiry(ttl);
            for (int i = 0; i < keys.size(); i++) {
                data.put(keys.get(i), Entry.ofString(updates.get(i), exp));
            }
            return true;
        });
    }

    @Override
    public Mono<Long> incrementIfBelow(String key, long limit, Duration ttl) {
        return locked(() -> {
            Entry e = live(key);
            long current = e == null ? 0 : Long.parseLong(e.string(key));
            if (current >= limit) return -1L;
            return incr(key, e == null ? expiry(ttl) : e.expiresAt);
        });
    }

    @Override
    public Mono<Boolean> zAddIfBelow(String key, double pruneUpTo, long limit, String member, double score, Duration ttl) {
        return locked(() -> {
            prune(key, Double.NEGATIVE_INFINITY, pruneUpTo);
            Map<String, Double> z = zset(key, false);
            if (z != null && z.size() >= limit) return false;
            zset(key, true).put(member, score);
            data.get(key).expiresAt = expiry(ttl);
            return true;
        });
    }

    private <T> Mono<T> locked(Callable<T> op) {
        return Mono.fromCallable(() -> {
            synchronized (lock) {
                sweepIfDue();
                return op.call();
            }
        });
    }

    /** Number of keys currently held, expired or not. */
    int size() {
        synchronized (lock) {
            return data.size();
        }
    }

    private void sweepIfDue() {
        long now = clock.millis();
        if (now < nextSweepAt) return;
        nextSweepAt = now + SWEEP_INTERVAL.toMillis();
        data.values().removeIf(e -> e.expiresAt <= now);
    }

    private Entry live(String key) {
        Entry e = data.get(key);
        if (e != null && e.expiresAt <= clock.millis()) {
            data.remove(key);
            return null;
        }
        return e;
    }

    private long incr(String key, long expiresAt) {
        Entry e = live(key);
        long next = (e == null ? 0 : Long.parseLong(e.string(key))) + 1;
        data.put(key, Entry.ofString(Long.toString(next), e == null ? expiresAt : e.expiresAt));
        return next;
    }

    private Map<String, Double> zset(String key, boolean create) {
        Entry e = live(key);
        if (e == null) {
            if (!create) return null;
            e = Entry.ofZset(NEVER);
            data.put(key, e);
        }
        if (e.zset == null) throw new IllegalStateException("WRONGTYPE key " + key + " does not hold a sorted set");
        return e.zset;
    }

    private long prune(String key, double min, double max) {
        Map<String, Double> z = zset(key, false);
        if (z == null) return 0;
        int before = z.size();
        z.values().removeIf(s -> s >= min && s <= max);
        if (z.isEmpty()) data.remove(key);
        return before - z.size();
    }

    private long expiry(Duration ttl) {
        return ttl == null ? NEVER : clock.millis() + RateLimitStore.ttlSeconds(ttl) * 1000;
    }

    private static List<ScoredMember> sorted(Map<String, Double> z) {
        List<ScoredMember> out = new ArrayList<>(z.size());
        z.forEach((m, s) -> out.add(new ScoredMember(m, s)));
        out.sort(Comparator.comparingDouble(ScoredMember::score).thenComparing(ScoredMember::member));
        return out;
    }

    static Pattern globToRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) sb.append(Pattern.quote(literal.toString()));
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    private static final class Entry {
        final String value;
        final Map<String, Double> zset;
        long expiresAt;

        private Entry(String value, Map<String, Double> zset, long expiresAt) {
            this.value = value;
            this.zset = zset;
            this.expiresAt = expiresAt;
        }

        static Entry ofString(String value, long expiresAt) {
            return new Entry(value, null, expiresAt);
        }

        static Entry ofZset(long expiresAt) {
            return new Entry(null, new HashMap<>(), expiresAt);
        }

        String string(String key) {
            if (zset != null) throw new IllegalStateException("WRONGTYPE key " + key + " holds a sorted set");
            return value;
        }
    }
}
