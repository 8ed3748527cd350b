package com.mercadolibre.ratelimiter.web.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mercadolibre.ratelimiter.application.RateLimiter;
import com.mercadolibre.ratelimiter.application.RateLimiterSettings;
import com.mercadolibre.ratelimiter.application.RatePolicyResolver;
import com.mercadolibre.ratelimiter.application.RoutePolicy;
import com.mercadolibre.ratelimiter.metrics.RateLimitMetrics;
import com.mercadolibre.ratelimiter.ratelimit.algorithm.AlgorithmRegistry;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.list.AccessListManager;
import com.mercadolibre.ratelimiter.ratelimit.memory.InMemoryRateLimitStore;
import com.mercadolibre.ratelimiter.support.MutableClock;
import com.mercadolibre.ratelimiter.web.RequestIdentityResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitWebFilterTest {

    MutableClock clock;
    RateLimiter limiter;
    SimpleMeterRegistry registry;
    RateLimitWebFilter filter;
    AtomicInteger chainCalls;
    WebFilterChain chain;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        InMemoryRateLimitStore store = new InMemoryRateLimitStore(clock);
        limiter = new RateLimiter(AlgorithmRegistry.standard(store, clock), new AccessListManager(store),
                RateLimiterSettings.defaults(), clock);
        RatePolicyResolver policies = new RatePolicyResolver(
                List.of(RoutePolicy.of("/auth/login", RateLimitConfig.of(2, 60, 2))),
                RateLimitConfig.of(100, 60),
                List.of("/healthz", "/actuator"));
        registry = new SimpleMeterRegistry();
        filter = new RateLimitWebFilter(limiter, policies, new RequestIdentityResolver(20),
                new RateLimitMetrics(registry), new ObjectMapper(), clock);
        chainCalls = new AtomicInteger();
        chain = ex -> { chainCalls.incrementAndGet(); return Mono.empty(); };
    }

    private MockServerWebExchange login(String ip) {
        return MockServerWebExchange.from(MockServerHttpRequest.post("/auth/login").header("X-Forwarded-For", ip).build());
    }

    @Test
    void allowed_request_passes_through_with_headers() {
        MockServerWebExchange exchange = login("1.2.3.4");

        filter.filter(exchange, chain).block();

        assertThat(chainCalls).hasValue(1);
        assertThat(exchange.getResponse().getStatusCode()).isNull();
        assertThat(exchange.getResponse().getHeaders().getFirst("X-RateLimit-Limit")).isEqualTo("2");
        assertThat(exchange.getResponse().getHeaders().getFirst("X-RateLimit-Remaining")).isEqualTo("1");
        assertThat(exchange.getResponse().getHeaders().getFirst("Retry-After")).isNull();
    }

    @Test
    void exhausted_route_returns_429_with_retry_after_and_does_not_call_chain() {
        filter.filter(login("1.2.3.4"), chain).block();
        filter.filter(login("1.2.3.4"), chain).block();

        MockServerWebExchange exchange = login("1.2.3.4");
        filter.filter(exchange, chain).block();

        assertThat(chainCalls).hasValue(2);
        assertThat(exchange.getResponse().getStatusCode().value()).isEqualTo(429);
        assertThat(exchange.getResponse().getHeaders().getFirst("Retry-After")).isEqualTo("30");
        assertThat(exchange.getResponse().getHeaders().getFirst("X-RateLimit-Remaining")).isEqualTo("0");
        assertThat(exchange.getResponse().getHeaders().getFirst("X-RateLimit-Reset-After")).isEqualTo("30");
        assertThat(exchange.getResponse().getBodyAsString().block())
                .contains("\"code\":429")
                .contains("\"retry_after\":30")
                .contains("\"limit\":2")
                .contains("\"window\":60")
                .contains("retry in 30 seconds");
        assertThat(registry.get(RateLimitMetrics.REJECTIONS).counter().count()).isEqualTo(1.0);
    }

    @Test
    void clients_are_limited_independently() {
        filter.filter(login("1.1.1.1"), chain).block();
        filter.filter(login("1.1.1.1"), chain).block();

        MockServerWebExchange other = login("2.2.2.2");
        filter.filter(other, chain).block();

        assertThat(other.getResponse().getStatusCode()).isNull();
        assertThat(chainCalls).hasValue(3);
    }

    @Test
    void bearer_token_limits_by_ip_and_user() {
        for (int i = 0; i < 2; i++) {
            filter.filter(MockServerWebExchange.from(MockServerHttpRequest.post("/auth/login")
                    .header("X-Forwarded-For", "1.2.3.4")
                    .header("Authorization", "Bearer alice-token").build()), chain).block();
        }

        MockServerWebExchange bob = MockServerWebExchange.from(MockServerHttpRequest.post("/auth/login")
                .header("X-Forwarded-For", "1.2.3.4")
                .header("Authorization", "Bearer bob-token").build());
        filter.filter(bob, chain).block();

        assertThat(bob.getResponse().getStatusCode()).isNull();
    }

    @Test
    void deny_listed_client_is_rejected_with_block_duration() {
        limiter.addToDenyList("6.6.6.6", null).block();

        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/items/1").header("X-Forwarded-For", "6.6.6.6").build());
        filter.filter(exchange, chain).block();

        assertThat(exchange.getResponse().getStatusCode().value()).isEqualTo(429);
        assertThat(exchange.getResponse().getHeaders().getFirst("Retry-After")).isEqualTo("60");
        assertThat(chainCalls).hasValue(0);
    }

    @Test
    void allow_listed_client_reports_the_route_limit() {
        limiter.addToAllowList("1.2.3.4", null).block();

        MockServerWebExchange exchange = login("1.2.3.4");
        filter.filter(exchange, chain).block();

        assertThat(chainCalls).hasValue(1);
        assertThat(exchange.getResponse().getHeaders().getFirst("X-RateLimit-Limit")).isEqualTo("2");
    }

    @Test
    void options_bypasses_filter_and_calls_chain() {
        limiter.addToDenyList("unknown", null).block();
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.method(HttpMethod.OPTIONS, "/auth/login").build());

        filter.filter(exchange, chain).block();

        assertThat(chainCalls).hasValue(1);
        assertThat(exchange.getResponse().getStatusCode()).isNull();
        assertThat(exchange.getResponse().getHeaders().getFirst("X-RateLimit-Limit")).isNull();
    }

    @Test
    void excluded_paths_are_not_limited() {
        limiter.addToDenyList("unknown", null).block();
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/actuator/health").build());

        filter.filter(exchange, chain).block();

        assertThat(chainCalls).hasValue(1);
        assertThat(exchange.getResponse().getStatusCode()).isNull();
    }
}
