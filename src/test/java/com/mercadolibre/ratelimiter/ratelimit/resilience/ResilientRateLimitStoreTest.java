package com.mercadolibre.ratelimiter.ratelimit.resilience;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResilientRateLimitStoreTest {

    RateLimitStore delegate;
    CircuitBreaker cb;
    ResilientRateLimitStore store;

    @BeforeEach
    void setUp() {
        delegate = mock(RateLimitStore.class);
        cb = CircuitBreaker.of("rateLimitStore", CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        TimeLimiter tl = TimeLimiter.of(TimeLimiterConfig.custom().timeoutDuration(Duration.ofMillis(100)).build());
        store = new ResilientRateLimitStore(delegate, cb, tl);
    }

    @Test
    void passes_results_through() {
        when(delegate.get("k")).thenReturn(Mono.just("v"));
        when(delegate.keys("p*")).thenReturn(Flux.just("p1", "p2"));

        StepVerifier.create(store.get("k")).expectNext("v").verifyComplete();
        StepVerifier.create(store.keys("p*")).expectNext("p1", "p2").verifyComplete();
    }

    @Test
    void slow_calls_time_out() {
        when(delegate.get("slow")).thenReturn(Mono.never());

        StepVerifier.create(store.get("slow"))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void repeated_failures_open_the_circuit() {
        when(delegate.exists("k")).thenReturn(Mono.error(new IllegalStateException("down")));
        StepVerifier.create(store.exists("k")).expectError(IllegalStateException.class).verify();
        StepVerifier.create(store.exists("k")).expectError(IllegalStateException.class).verify();

        assertThat(cb.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        when(delegate.get("k")).thenReturn(Mono.just("v"));
        StepVerifier.create(store.get("k")).expectError(CallNotPermittedException.class).verify();
    }

    @Test
    void call_is_not_forwarded_while_open() {
        cb.transitionToOpenState();
        AtomicInteger subscriptions = new AtomicInteger();
        when(delegate.zCard("z")).thenReturn(Mono.fromCallable(() -> (long) subscriptions.incrementAndGet()));

        StepVerifier.create(store.zCard("z")).expectError(CallNotPermittedException.class).verify();
        assertThat(subscriptions).hasValue(0);
    }
}
