package com.mercadolibre.ratelimiter;

import com.mercadolibre.ratelimiter.application.RatePolicyResolver;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import com.mercadolibre.ratelimiter.ratelimit.resilience.ResilientRateLimitStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
class RateLimiterApplicationTest {

    @Autowired
    WebTestClient client;

    @Autowired
    RatePolicyResolver policies;

    @Autowired
    RateLimitStore store;

    @Test
    void routes_bind_from_configuration() {
        assertThat(policies.routes()).hasSize(4);
        assertThat(policies.resolve("/users/register", HttpMethod.POST)).isEqualTo(RateLimitConfig.of(5, 3600));
        assertThat(policies.defaultConfig()).isEqualTo(RateLimitConfig.of(100, 60, 10));
        assertThat(policies.isExcluded("/actuator/health")).isTrue();
        assertThat(store).isInstanceOf(ResilientRateLimitStore.class);
    }

    @Test
    void login_route_is_limited_end_to_end() {
        for (int i = 0; i < 10; i++) {
            client.post().uri("/auth/login")
                    .header("X-Forwarded-For", "203.0.113.7")
                    .exchange()
                    .expectStatus().value(status -> assertThat(status).isNotEqualTo(429));
        }

        client.post().uri("/auth/login")
                .header("X-Forwarded-For", "203.0.113.7")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().exists("Retry-After")
                .expectBody()
                .jsonPath("$.code").isEqualTo(429)
                .jsonPath("$.limit").isEqualTo(10)
                .jsonPath("$.window").isEqualTo(60);
    }

    @Test
    void deny_list_through_admin_api() {
        client.post().uri("/rate-limit/blacklist")
                .header("X-Forwarded-For", "198.51.100.1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"identifier\":\"198.51.100.99\",\"expire_time\":60}")
                .exchange()
                .expectStatus().isOk();

        client.get().uri("/anything")
                .header("X-Forwarded-For", "198.51.100.99")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals("Retry-After", "60");
    }

    @Test
    void health_is_not_limited() {
        client.get().uri("/healthz")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().doesNotExist("X-RateLimit-Limit")
                .expectBody(String.class).isEqualTo("ok");
    }
}
