package com.mercadolibre.ratelimiter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mercadolibre.ratelimiter.application.RateLimiter;
import com.mercadolibre.ratelimiter.application.RateLimiterSettings;
import com.mercadolibre.ratelimiter.application.RatePolicyResolver;
import com.mercadolibre.ratelimiter.metrics.RateLimitMetrics;
import com.mercadolibre.ratelimiter.ratelimit.algorithm.AlgorithmRegistry;
import com.mercadolibre.ratelimiter.ratelimit.core.AlgorithmType;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitStore;
import com.mercadolibre.ratelimiter.ratelimit.list.AccessListManager;
import com.mercadolibre.ratelimiter.ratelimit.memory.InMemoryRateLimitStore;
import com.mercadolibre.ratelimiter.ratelimit.redis.RedisRateLimitStore;
import com.mercadolibre.ratelimiter.ratelimit.resilience.ResilientRateLimitStore;
import com.mercadolibre.ratelimiter.web.RequestIdentityResolver;
import com.mercadolibre.ratelimiter.web.filter.RateLimitWebFilter;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RateLimiterProperties.class)
public class RateLimiterConfig {

    public static final String STORE_INSTANCE = "rateLimitStore";

    @Bean
    public Clock rateLimiterClock() {
        return Clock.systemUTC();
    }

    @Bean("baseRateLimitStore")
    @ConditionalOnProperty(name = "rate-limiter.storage", havingValue = "memory", matchIfMissing = true)
    public RateLimitStore memoryStore(Clock clock) {
        return new InMemoryRateLimitStore(clock);
    }

    @Bean("baseRateLimitStore")
    @ConditionalOnProperty(name = "rate-limiter.storage", havingValue = "redis")
    public RateLimitStore redisStore(ReactiveStringRedisTemplate tpl) {
        return new RedisRateLimitStore(tpl);
    }

    @Bean
    @Primary
    public RateLimitStore resilientStore(
            @Qualifier("baseRateLimitStore") RateLimitStore base,
            CircuitBreakerRegistry cbRegistry,
            TimeLimiterRegistry tlRegistry
    ) {
        return new ResilientRateLimitStore(
                base,
                cbRegistry.circuitBreaker(STORE_INSTANCE),
                tlRegistry.timeLimiter(STORE_INSTANCE)
        );
    }

    @Bean
    public AlgorithmRegistry algorithmRegistry(RateLimitStore store, Clock clock) {
        return AlgorithmRegistry.standard(store, clock);
    }

    @Bean
    public AccessListManager accessListManager(RateLimitStore store) {
        return new AccessListManager(store);
    }

    @Bean
    public RateLimiterSettings rateLimiterSettings(RateLimiterProperties props) {
        return new RateLimiterSettings(
                props.enabled(),
                AlgorithmType.fromName(props.algorithm()),
                props.allowListEnabled(),
                props.denyListEnabled(),
                props.logViolations(),
                props.storage(),
                props.defaults().toConfig()
        );
    }

    @Bean
    public RateLimiter rateLimiter(AlgorithmRegistry algorithms, AccessListManager lists,
                                   RateLimiterSettings settings, Clock clock) {
        return new RateLimiter(algorithms, lists, settings, clock);
    }

    @Bean
    public RatePolicyResolver ratePolicyResolver(RateLimiterProperties props) {
        return new RatePolicyResolver(props.routePolicies(), props.defaults().toConfig(), props.excludePathsOrEmpty());
    }

    @Bean
    public RequestIdentityResolver requestIdentityResolver(@Value("${rate-limiter.user-id-length:20}") int userIdLength) {
        return new RequestIdentityResolver(userIdLength);
    }

    @Bean
    public RateLimitWebFilter rateLimitWebFilter(RateLimiter limiter, RatePolicyResolver policies,
                                                 RequestIdentityResolver identity, RateLimitMetrics metrics,
                                                 ObjectMapper mapper, Clock clock) {
        return new RateLimitWebFilter(limiter, policies, identity, metrics, mapper, clock);
    }
}
