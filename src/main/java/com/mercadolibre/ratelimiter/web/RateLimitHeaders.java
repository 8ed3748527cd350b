package com.mercadolibre.ratelimiter.web;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitResult;
import org.springframework.http.HttpHeaders;

public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RESET_AFTER = "X-RateLimit-Reset-After";

    private RateLimitHeaders() {}

    /** The limit header always carries the route's configured limit, also for unlimited results. */
    public static void apply(HttpHeaders headers, RateLimitResult result, RateLimitConfig config, long nowSeconds) {
        headers.set(LIMIT, String.valueOf(config.limit()));
        headers.set(REMAINING, String.valueOf(result.remaining()));
        headers.set(RESET, String.valueOf(result.resetTime()));
        headers.set(RESET_AFTER, String.valueOf(result.resetAfter(nowSeconds)));
        result.retryAfterOpt().ifPresent(sec -> headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(sec)));
    }
}
