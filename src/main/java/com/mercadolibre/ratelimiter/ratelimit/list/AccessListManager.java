package com.mercadolibre.ratelimiter.ratelimit.list;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Allow/deny list membership, stored as presence keys ({@code rate_limit:whitelist:<id>} and
 * {@code rate_limit:blacklist:<id>}) with optional expiry. Store failures are logged and reported as
 * {@code false} / empty, never as errors.
 */
public class AccessListManager {

    private static final Logger log = LoggerFactory.getLogger(AccessListManager.class);
    private static final String PRESENT = "1";

    private final RateLimitStore store;

    public AccessListManager(RateLimitStore store) {
        this.store = store;
    }

    /**
     * @param expire entry lifetime, {@code null} to keep it until removed
     */
    public Mono<Boolean> add(ListKind kind, String identifier, Duration expire) {
        requireIdentifier(identifier);
        return store.set(kind.key(identifier), PRESENT, expire)
                .defaultIfEmpty(true)
                .doOnNext(ok -> log.info("added {} to {} (expire={})", identifier, kind.namespace(), expire))
                .onErrorResume(e -> {
                    log.error("failed to add {} to {}: {}", identifier, kind.namespace(), e.toString());
                    return Mono.just(false);
                });
    }

    /** True only when an entry was present and removed. */
    public Mono<Boolean> remove(ListKind kind, String identifier) {
        requireIdentifier(identifier);
        return store.delete(kind.key(identifier))
                .defaultIfEmpty(false)
                .doOnNext(removed -> {
                    if (removed) log.info("removed {} from {}", identifier, kind.namespace());
                })
                .onErrorResume(e -> {
                    log.error("failed to remove {} from {}: {}", identifier, kind.namespace(), e.toString());
                    return Mono.just(false);
                });
    }

    public Mono<Boolean> isMember(ListKind kind, String identifier) {
        if (identifier == null || identifier.isBlank()) return Mono.just(false);
        return store.exists(kind.key(identifier))
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.error("failed to check {} membership of {}: {}", kind.namespace(), identifier, e.toString());
                    return Mono.just(false);
                });
    }

    public Flux<AccessListEntry> list(ListKind kind) {
        String prefix = kind.keyPrefix();
        return store.keys(prefix + "*")
                .concatMap(key -> store.ttl(key)
                        .filter(ttl -> ttl != RateLimitStore.TTL_MISSING)
                        .map(ttl -> new AccessListEntry(key.substring(prefix.length()), ttl > 0 ? ttl : null)))
                .onErrorResume(e -> {
                    log.error("failed to list {}: {}", kind.namespace(), e.toString());
                    return Flux.empty();
                });
    }

    private static void requireIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier is required");
        }
    }
}
