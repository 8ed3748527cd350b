package com.mercadolibre.ratelimiter.application;

import com.mercadolibre.ratelimiter.ratelimit.algorithm.AlgorithmRegistry;
import com.mercadolibre.ratelimiter.ratelimit.algorithm.RateLimitAlgorithm;
import com.mercadolibre.ratelimiter.ratelimit.core.AlgorithmType;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitResult;
import com.mercadolibre.ratelimiter.ratelimit.core.Scope;
import com.mercadolibre.ratelimiter.ratelimit.core.ScopeKeyBuilder;
import com.mercadolibre.ratelimiter.ratelimit.list.AccessListEntry;
import com.mercadolibre.ratelimiter.ratelimit.list.AccessListManager;
import com.mercadolibre.ratelimiter.ratelimit.list.ListKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Entry point of the limiter: deny-list, then allow-list, then the selected algorithm.
 *
 * <p>Holds no mutable state; everything lives in the store. Any failure while deciding lets the
 * request through with {@code config.limit()} remaining.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final AlgorithmRegistry algorithms;
    private final AccessListManager lists;
    private final RateLimiterSettings settings;
    private final Clock clock;

    public RateLimiter(AlgorithmRegistry algorithms, AccessListManager lists, RateLimiterSettings settings, Clock clock) {
        this.algorithms = algorithms;
        this.lists = lists;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Consumes one permit for the scoped key.
     *
     * @param algorithm algorithm name; {@code null} selects the configured default, unknown names the token bucket
     * @param config    route policy; {@code null} selects the default policy
     */
    public Mono<RateLimitResult> isAllowed(Scope scope, String identifier, String algorithm, RateLimitConfig config,
                                           String endpoint, String userId) {
        RateLimitConfig cfg = config != null ? config : settings.defaultConfig();
        if (!settings.enabled() || !cfg.enabled()) {
            return Mono.fromSupplier(() -> RateLimitResult.unlimited(nowSeconds()));
        }
        return Mono.defer(() -> overrides(identifier, cfg)
                        .switchIfEmpty(Mono.defer(() -> consume(scope, identifier, algorithm, cfg, endpoint, userId))))
                .onErrorResume(e -> {
                    log.error("rate limit check failed for {}:{}, allowing request", scope, identifier, e);
                    return Mono.just(failOpen(cfg));
                });
    }

    /**
     * Same decision path as {@link #isAllowed} without consuming a permit. Allowed while any permit remains.
     */
    public Mono<RateLimitResult> peek(Scope scope, String identifier, String algorithm, RateLimitConfig config,
                                      String endpoint, String userId) {
        RateLimitConfig cfg = config != null ? config : settings.defaultConfig();
        if (!settings.enabled() || !cfg.enabled()) {
            return Mono.fromSupplier(() -> RateLimitResult.unlimited(nowSeconds()));
        }
        return Mono.defer(() -> overrides(identifier, cfg)
                        .switchIfEmpty(Mono.defer(() -> {
                            String key = ScopeKeyBuilder.buildKey(scope, identifier, endpoint, userId);
                            RateLimitAlgorithm algo = algorithmFor(algorithm);
                            return algo.getRemaining(key, cfg)
                                    .flatMap(remaining -> algo.getResetTime(key, cfg)
                                            .map(reset -> result(remaining > 0, remaining, reset, cfg)));
                        })))
                .onErrorResume(e -> {
                    log.error("rate limit peek failed for {}:{}", scope, identifier, e);
                    return Mono.just(failOpen(cfg));
                });
    }

    public Mono<Boolean> addToAllowList(String identifier, Duration expire) {
        return lists.add(ListKind.ALLOW, identifier, expire);
    }

    public Mono<Boolean> removeFromAllowList(String identifier) {
        return lists.remove(ListKind.ALLOW, identifier);
    }

    public Flux<AccessListEntry> listAllowList() {
        return lists.list(ListKind.ALLOW);
    }

    public Mono<Boolean> addToDenyList(String identifier, Duration expire) {
        return lists.add(ListKind.DENY, identifier, expire);
    }

    public Mono<Boolean> removeFromDenyList(String identifier) {
        return lists.remove(ListKind.DENY, identifier);
    }

    public Flux<AccessListEntry> listDenyList() {
        return lists.list(ListKind.DENY);
    }

    public Mono<RateLimitStats> getStats(Scope scope, String identifier, String endpoint, String userId) {
        String key = ScopeKeyBuilder.buildKey(scope, identifier, endpoint, userId);
        return Mono.zip(lists.isMember(ListKind.ALLOW, identifier), lists.isMember(ListKind.DENY, identifier))
                .map(t -> new RateLimitStats(scope.tag(), identifier, key, t.getT1(), t.getT2()));
    }

    public RateLimiterSettings getSettings() {
        return settings;
    }

    /** Deny-list rejection or allow-list bypass; empty when neither applies. */
    private Mono<RateLimitResult> overrides(String identifier, RateLimitConfig cfg) {
        Mono<Boolean> denied = settings.denyListEnabled() ? lists.isMember(ListKind.DENY, identifier) : Mono.just(false);
        return denied.flatMap(isDenied -> {
            if (isDenied) {
                log.warn("{} is deny-listed, rejecting request", identifier);
                long now = nowSeconds();
                return Mono.just(RateLimitResult.denied(0, now + cfg.blockDuration(), cfg.limit(), cfg.blockDuration()));
            }
            Mono<Boolean> allowed = settings.allowListEnabled() ? lists.isMember(ListKind.ALLOW, identifier) : Mono.just(false);
            return allowed.flatMap(isAllowed -> {
                if (!isAllowed) return Mono.empty();
                log.debug("{} is allow-listed, bypassing limits", identifier);
                return Mono.just(RateLimitResult.unlimited(nowSeconds()));
            });
        });
    }

    private Mono<RateLimitResult> consume(Scope scope, String identifier, String algorithm, RateLimitConfig cfg,
                                          String endpoint, String userId) {
        String key = ScopeKeyBuilder.buildKey(scope, identifier, endpoint, userId);
        RateLimitAlgorithm algo = algorithmFor(algorithm);
        return algo.isAllowed(key, cfg)
                .flatMap(allowed -> algo.getRemaining(key, cfg)
                        .flatMap(remaining -> algo.getResetTime(key, cfg)
                                .map(reset -> result(allowed, remaining, reset, cfg))))
                .doOnNext(r -> {
                    if (!r.allowed() && settings.logViolations()) {
                        log.warn("rate limit exceeded: key={} identifier={} algorithm={} retryAfter={}s",
                                key, identifier, algo.type().id(), r.retryAfter());
                    }
                });
    }

    private RateLimitResult result(boolean allowed, int remaining, long reset, RateLimitConfig cfg) {
        if (allowed) return RateLimitResult.allowed(remaining, reset, cfg.limit());
        long retryAfter = Math.max(0, reset - nowSeconds());
        return RateLimitResult.denied(remaining, reset, cfg.limit(), (int) Math.min(Integer.MAX_VALUE, retryAfter));
    }

    private RateLimitAlgorithm algorithmFor(String name) {
        if (name == null || name.isBlank()) return algorithms.resolve(settings.defaultAlgorithm());
        return AlgorithmType.lookup(name)
                .map(algorithms::resolve)
                .orElseGet(() -> {
                    log.debug("unknown algorithm '{}', using {}", name, AlgorithmType.TOKEN_BUCKET.id());
                    return algorithms.resolve(AlgorithmType.TOKEN_BUCKET);
                });
    }

    private RateLimitResult failOpen(RateLimitConfig cfg) {
        return RateLimitResult.allowed(cfg.limit(), nowSeconds() + cfg.window(), cfg.limit());
    }

    private long nowSeconds() {
        return clock.millis() / 1000;
    }
}
