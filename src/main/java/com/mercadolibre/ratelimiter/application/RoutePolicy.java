package com.mercadolibre.ratelimiter.application;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import org.springframework.http.HttpMethod;

import java.util.Objects;
import java.util.Set;

/**
 * Limit applied to a path prefix.
 *
 * @param methods methods the policy applies to; empty means any method
 */
public record RoutePolicy(String path, Set<HttpMethod> methods, RateLimitConfig config) {

    public RoutePolicy {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("route path is required");
        }
        Objects.requireNonNull(config, "config");
        methods = methods == null ? Set.of() : Set.copyOf(methods);
    }

    public static RoutePolicy of(String path, RateLimitConfig config) {
        return new RoutePolicy(path, Set.of(), config);
    }

    boolean appliesTo(HttpMethod method) {
        return methods.isEmpty() || (method != null && methods.contains(method));
    }
}
