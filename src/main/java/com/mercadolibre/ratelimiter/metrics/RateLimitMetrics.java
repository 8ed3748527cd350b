package com.mercadolibre.ratelimiter.metrics;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitResult;
import com.mercadolibre.ratelimiter.ratelimit.core.Scope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class RateLimitMetrics {

    public static final String DECISIONS = "rate_limit_decisions_total";
    public static final String REJECTIONS = "rate_limit_rejections_total";

    public static final String ALLOWED = "allowed";
    public static final String REJECTED = "rejected";
    public static final String UNLIMITED = "unlimited";

    private final MeterRegistry registry;

    public RateLimitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(Scope scope, RateLimitResult result) {
        String outcome = outcome(result);
        Counter.builder(DECISIONS)
                .description("Rate limit decisions by outcome")
                .tags("outcome", outcome, "scope", scope != null ? scope.tag() : "unknown")
                .register(registry)
                .increment();

        if (REJECTED.equals(outcome)) {
            incrementRejection();
        }
    }

    public void incrementRejection() {
        Counter.builder(REJECTIONS)
                .description("Total number of requests rejected by rate limiting")
                .register(registry)
                .increment();
    }

    static String outcome(RateLimitResult result) {
        if (!result.allowed()) return REJECTED;
        return result.limit() == RateLimitResult.UNLIMITED ? UNLIMITED : ALLOWED;
    }
}
