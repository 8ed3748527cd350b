package com.mercadolibre.ratelimiter.application;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RateLimitStats(
        String scope,
        String identifier,
        @JsonProperty("rate_limit_key") String rateLimitKey,
        boolean whitelisted,
        boolean blacklisted
) {}
