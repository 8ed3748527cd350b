package com.mercadolibre.ratelimiter.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.time.Duration;

/**
 * @param expireTime entry lifetime in seconds, at most 30 days; absent for a permanent entry
 */
public record AccessListRequest(
        @NotBlank String identifier,
        @JsonProperty("expire_time") @Min(1) @Max(2_592_000) Long expireTime
) {
    public Duration expire() {
        return expireTime != null ? Duration.ofSeconds(expireTime) : null;
    }
}
