package com.mercadolibre.ratelimiter.web;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of a 429 response. */
public record RateLimitRejection(
        int code,
        String message,
        @JsonProperty("retry_after") int retryAfter,
        int limit,
        int window
) {
    public static RateLimitRejection of(int retryAfter, int limit, int window) {
        return new RateLimitRejection(429, "Too many requests, retry in " + retryAfter + " seconds",
                retryAfter, limit, window);
    }
}
