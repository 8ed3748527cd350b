package com.mercadolibre.ratelimiter.config;

import com.mercadolibre.ratelimiter.application.RoutePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterPropertiesTest {

    @Test
    void route_methods_are_parsed_independently_of_the_default_locale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            RoutePolicy policy = new RateLimiterProperties.Route("/items", List.of(" get", "options"), 10, 60, 10, 60, true)
                    .toPolicy();

            assertThat(policy.methods()).containsExactlyInAnyOrder(HttpMethod.GET, HttpMethod.OPTIONS);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
