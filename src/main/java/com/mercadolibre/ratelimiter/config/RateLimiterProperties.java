package com.mercadolibre.ratelimiter.config;

import com.mercadolibre.ratelimiter.application.RoutePolicy;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.http.HttpMethod;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Validated
@ConfigurationProperties(prefix = "rate-limiter")
public record RateLimiterProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("token_bucket") @NotBlank String algorithm,   // token_bucket | sliding_window | fixed_window
        @DefaultValue("memory") @NotBlank String storage,           // memory | redis
        @DefaultValue("true") boolean allowListEnabled,
        @DefaultValue("true") boolean denyListEnabled,
        @DefaultValue("true") boolean logViolations,
        @Valid @NotNull Policy defaults,
        @Valid List<Route> routes,
        List<String> excludePaths
) {

    public record Policy(
            @Min(1) int limit,
            @Min(1) int window,
            @DefaultValue("10") @Min(1) int burst,
            @DefaultValue("60") @Min(1) int blockDuration,
            @DefaultValue("true") boolean enabled
    ) {
        public RateLimitConfig toConfig() {
            return new RateLimitConfig(limit, window, burst, blockDuration, enabled);
        }
    }

    public record Route(
            @NotBlank String path,
            List<String> methods,                                   // empty = any method
            @Min(1) int limit,
            @Min(1) int window,
            @DefaultValue("10") @Min(1) int burst,
            @DefaultValue("60") @Min(1) int blockDuration,
            @DefaultValue("true") boolean enabled
    ) {
        public RoutePolicy toPolicy() {
            Set<HttpMethod> parsed = new LinkedHashSet<>();
            if (methods != null) {
                methods.forEach(m -> parsed.add(HttpMethod.valueOf(m.trim().toUpperCase(Locale.ROOT))));
            }
            return new RoutePolicy(path, parsed, new RateLimitConfig(limit, window, burst, blockDuration, enabled));
        }
    }

    public List<RoutePolicy> routePolicies() {
        return routes == null ? List.of() : routes.stream().map(Route::toPolicy).toList();
    }

    public List<String> excludePathsOrEmpty() {
        return excludePaths == null ? List.of() : excludePaths;
    }
}
