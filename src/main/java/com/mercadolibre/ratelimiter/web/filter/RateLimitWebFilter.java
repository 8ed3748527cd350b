package com.mercadolibre.ratelimiter.web.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mercadolibre.ratelimiter.application.RateLimiter;
import com.mercadolibre.ratelimiter.application.RatePolicyResolver;
import com.mercadolibre.ratelimiter.metrics.RateLimitMetrics;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitResult;
import com.mercadolibre.ratelimiter.ratelimit.core.Scope;
import com.mercadolibre.ratelimiter.web.RateLimitHeaders;
import com.mercadolibre.ratelimiter.web.RateLimitRejection;
import com.mercadolibre.ratelimiter.web.RequestIdentityResolver;
import org.springframework.core.Ordered;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Limits every non-excluded request by client IP, or by IP and user when a bearer token is present.
 * Admitted and rejected responses both carry the {@code X-RateLimit-*} headers.
 */
public class RateLimitWebFilter implements WebFilter, Ordered {

    private final RateLimiter limiter;
    private final RatePolicyResolver policies;
    private final RequestIdentityResolver identity;
    private final RateLimitMetrics metrics;
    private final ObjectMapper mapper;
    private final Clock clock;

    public RateLimitWebFilter(RateLimiter limiter, RatePolicyResolver policies, RequestIdentityResolver identity,
                              RateLimitMetrics metrics, ObjectMapper mapper, Clock clock) {
        this.limiter = limiter;
        this.policies = policies;
        this.identity = identity;
        this.metrics = metrics;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().value();
        if (HttpMethod.OPTIONS.equals(request.getMethod()) || policies.isExcluded(path)) {
            return chain.filter(exchange);
        }

        String ip = identity.clientIp(request);
        String userId = identity.userId(request);
        Scope scope = userId != null ? Scope.IP_USER : Scope.IP;
        RateLimitConfig config = policies.resolve(path, request.getMethod());

        return limiter.isAllowed(scope, ip, null, config, path, userId)
                .flatMap(result -> {
                    metrics.recordDecision(scope, result);
                    ServerHttpResponse resp = exchange.getResponse();
                    if (resp.isCommitted()) return Mono.empty();
                    RateLimitHeaders.apply(resp.getHeaders(), result, config, clock.millis() / 1000);
                    if (result.allowed()) return chain.filter(exchange);
                    return reject(resp, result, config);
                });
    }

    private Mono<Void> reject(ServerHttpResponse resp, RateLimitResult result, RateLimitConfig config) {
        resp.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        resp.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        RateLimitRejection body = RateLimitRejection.of(result.retryAfter(), result.limit(), config.window());
        return Mono.fromCallable(() -> mapper.writeValueAsBytes(body))
                .flatMap(bytes -> resp.writeWith(Mono.just(resp.bufferFactory().wrap(bytes))));
    }
}
