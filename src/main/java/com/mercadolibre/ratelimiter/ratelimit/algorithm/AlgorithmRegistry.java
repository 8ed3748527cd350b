package com.mercadolibre.ratelimiter.ratelimit.algorithm;

import com.mercadolibre.ratelimiter.ratelimit.core.AlgorithmType;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class AlgorithmRegistry {

    private final Map<AlgorithmType, RateLimitAlgorithm> algorithms = new EnumMap<>(AlgorithmType.class);

    public AlgorithmRegistry(List<RateLimitAlgorithm> algorithms) {
        for (RateLimitAlgorithm a : algorithms) {
            this.algorithms.put(a.type(), a);
        }
        if (!this.algorithms.containsKey(AlgorithmType.TOKEN_BUCKET)) {
            throw new IllegalStateException("token bucket algorithm is required as the fallback");
        }
    }

    public static AlgorithmRegistry standard(RateLimitStore store, Clock clock) {
        return new AlgorithmRegistry(List.of(
                new TokenBucket(store, clock),
                new SlidingWindow(store, clock),
                new FixedWindow(store, clock)));
    }

    /** Unknown names and unregistered types resolve to the token bucket. */
    public RateLimitAlgorithm resolve(String name) {
        return resolve(AlgorithmType.fromName(name));
    }

    public RateLimitAlgorithm resolve(AlgorithmType type) {
        RateLimitAlgorithm a = algorithms.get(type);
        return a != null ? a : algorithms.get(AlgorithmType.TOKEN_BUCKET);
    }

    public Collection<RateLimitAlgorithm> all() {
        return Collections.unmodifiableCollection(algorithms.values());
    }
}
