package com.mercadolibre.ratelimiter.application;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import org.springframework.http.HttpMethod;

import java.util.List;

/**
 * Picks the {@link RateLimitConfig} for a request path.
 *
 * <p>An exact path match wins, then the longest registered prefix, then the default. Routes of equal
 * length keep registration order.
 */
public class RatePolicyResolver {

    private final List<RoutePolicy> routes;
    private final RateLimitConfig defaultConfig;
    private final List<String> excludedPaths;

    public RatePolicyResolver(List<RoutePolicy> routes, RateLimitConfig defaultConfig, List<String> excludedPaths) {
        if (defaultConfig == null) {
            throw new IllegalStateException("a default rate limit policy is required");
        }
        this.routes = routes == null ? List.of() : List.copyOf(routes);
        this.defaultConfig = defaultConfig;
        this.excludedPaths = excludedPaths == null ? List.of() : List.copyOf(excludedPaths);
    }

    public RateLimitConfig resolve(String path, HttpMethod method) {
        if (path == null) return defaultConfig;

        for (RoutePolicy route : routes) {
            if (route.path().equals(path) && route.appliesTo(method)) return route.config();
        }

        RoutePolicy best = null;
        for (RoutePolicy route : routes) {
            if (!path.startsWith(route.path()) || !route.appliesTo(method)) continue;
            if (best == null || route.path().length() > best.path().length()) best = route;
        }
        return best != null ? best.config() : defaultConfig;
    }

    public boolean isExcluded(String path) {
        if (path == null) return false;
        for (String excluded : excludedPaths) {
            if (path.startsWith(excluded)) return true;
        }
        return false;
    }

    public RateLimitConfig defaultConfig() {
        return defaultConfig;
    }

    public List<RoutePolicy> routes() {
        return routes;
    }
}
