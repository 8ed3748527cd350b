package com.mercadolibre.ratelimiter.management;

import com.mercadolibre.ratelimiter.metrics.RateLimitMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.Search;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@Endpoint(id = "ratelimitstats")
public class RateLimitStatsEndpoint {

    private final MeterRegistry registry;

    public RateLimitStatsEndpoint(MeterRegistry registry) {
        this.registry = registry;
    }

    @ReadOperation
    public Map<String, Object> stats() {
        Map<String, Object> out = new HashMap<>();

        Map<String, Double> byOutcome = new HashMap<>();
        Map<String, Double> byScope = new HashMap<>();
        registry.find(RateLimitMetrics.DECISIONS).counters().forEach(c -> {
            String outcome = c.getId().getTag("outcome");
            String scope = c.getId().getTag("scope");
            byOutcome.merge(outcome != null ? outcome : "unknown", c.count(), Double::sum);
            byScope.merge(scope != null ? scope : "unknown", c.count(), Double::sum);
        });
        out.put("decisions_by_outcome_total", byOutcome);
        out.put("decisions_by_scope_total", byScope);

        Counter rej = Search.in(registry).name(RateLimitMetrics.REJECTIONS).counter();
        out.put("rate_limit_rejections_total", rej != null ? rej.count() : 0d);

        return out;
    }
}
