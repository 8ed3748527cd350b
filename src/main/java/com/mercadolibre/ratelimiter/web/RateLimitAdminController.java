package com.mercadolibre.ratelimiter.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mercadolibre.ratelimiter.application.RateLimitStats;
import com.mercadolibre.ratelimiter.application.RateLimiter;
import com.mercadolibre.ratelimiter.application.RateLimiterSettings;
import com.mercadolibre.ratelimiter.application.RatePolicyResolver;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimitResult;
import com.mercadolibre.ratelimiter.ratelimit.core.Scope;
import com.mercadolibre.ratelimiter.ratelimit.list.AccessListEntry;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Operator API for allow/deny lists, key inspection and non-consuming checks.
 */
@RestController
@RequestMapping(value = "/rate-limit", produces = MediaType.APPLICATION_JSON_VALUE)
public class RateLimitAdminController {

    private final RateLimiter limiter;
    private final RatePolicyResolver policies;

    public RateLimitAdminController(RateLimiter limiter, RatePolicyResolver policies) {
        this.limiter = limiter;
        this.policies = policies;
    }

    @GetMapping("/stats")
    public Mono<RateLimitStats> stats(@RequestParam String scope,
                                      @RequestParam String identifier,
                                      @RequestParam(required = false) String endpoint,
                                      @RequestParam(name = "user_id", required = false) String userId) {
        return limiter.getStats(Scope.from(scope), requireIdentifier(identifier), endpoint, userId);
    }

    @PostMapping("/whitelist")
    public Mono<ResponseEntity<Map<String, Object>>> addToAllowList(@Valid @RequestBody AccessListRequest body) {
        return added(body, limiter::addToAllowList);
    }

    @DeleteMapping("/whitelist/{identifier}")
    public Mono<ResponseEntity<Map<String, Object>>> removeFromAllowList(@PathVariable String identifier) {
        return removed(identifier, limiter::removeFromAllowList);
    }

    @GetMapping("/whitelist")
    public Mono<List<AccessListEntry>> allowList() {
        return limiter.listAllowList().collectList();
    }

    @PostMapping("/blacklist")
    public Mono<ResponseEntity<Map<String, Object>>> addToDenyList(@Valid @RequestBody AccessListRequest body) {
        return added(body, limiter::addToDenyList);
    }

    @DeleteMapping("/blacklist/{identifier}")
    public Mono<ResponseEntity<Map<String, Object>>> removeFromDenyList(@PathVariable String identifier) {
        return removed(identifier, limiter::removeFromDenyList);
    }

    @GetMapping("/blacklist")
    public Mono<List<AccessListEntry>> denyList() {
        return limiter.listDenyList().collectList();
    }

    /** Reports what a request would get, without consuming a permit. */
    @PostMapping("/check")
    public Mono<CheckResponse> check(@RequestParam String scope,
                                     @RequestParam String identifier,
                                     @RequestParam(required = false) String endpoint,
                                     @RequestParam(name = "user_id", required = false) String userId,
                                     @RequestParam(required = false) String algorithm) {
        Scope s = Scope.from(scope);
        String id = requireIdentifier(identifier);
        RateLimitConfig config = endpoint != null ? policies.resolve(endpoint, null) : policies.defaultConfig();
        return limiter.peek(s, id, algorithm, config, endpoint, userId).map(CheckResponse::from);
    }

    @GetMapping("/config")
    public Map<String, Object> config() {
        RateLimiterSettings s = limiter.getSettings();
        RateLimitConfig d = s.defaultConfig();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("enabled", s.enabled());
        out.put("algorithm", s.defaultAlgorithm().id());
        out.put("storage", s.storage());
        out.put("default_requests", d.limit());
        out.put("default_window", d.window());
        out.put("default_burst", d.burst());
        out.put("block_duration", d.blockDuration());
        out.put("enable_whitelist", s.allowListEnabled());
        out.put("enable_blacklist", s.denyListEnabled());
        out.put("log_violations", s.logViolations());
        return out;
    }

    private static Mono<ResponseEntity<Map<String, Object>>> added(
            AccessListRequest body, BiFunction<String, Duration, Mono<Boolean>> op) {
        return op.apply(body.identifier(), body.expire()).map(ok -> {
            Map<String, Object> out = new HashMap<>();
            out.put("identifier", body.identifier());
            out.put("expire_time", body.expireTime());
            return ok ? ResponseEntity.ok(out) : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(out);
        });
    }

    private static Mono<ResponseEntity<Map<String, Object>>> removed(
            String identifier, Function<String, Mono<Boolean>> op) {
        return op.apply(identifier).map(ok -> {
            Map<String, Object> out = Map.of("identifier", identifier);
            return ok ? ResponseEntity.ok(out) : ResponseEntity.status(HttpStatus.NOT_FOUND).body(out);
        });
    }

    private static String requireIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier is required");
        }
        return identifier;
    }

    public record CheckResponse(
            boolean allowed,
            int remaining,
            @JsonProperty("reset_time") long resetTime,
            int limit,
            @JsonProperty("retry_after") Integer retryAfter
    ) {
        static CheckResponse from(RateLimitResult r) {
            return new CheckResponse(r.allowed(), r.remaining(), r.resetTime(), r.limit(), r.retryAfter());
        }
    }
}
