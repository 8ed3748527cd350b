package com.mercadolibre.ratelimiter.ratelimit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Maps (scope, identifier, endpoint, user) to the storage key namespace.
 *
 * <p>Layout: {@code rate_limit:<scope tag>[:component...]}. Components are URL-encoded so
 * {@code ':'} and {@code '/'} never appear inside them, which keeps the mapping injective.
 * Scopes that need a user or an endpoint fall back to {@link Scope#IP} when it is missing.
 */
public final class ScopeKeyBuilder {

    private static final Logger log = LoggerFactory.getLogger(ScopeKeyBuilder.class);

    public static final String PREFIX = "rate_limit";
    public static final char DELIMITER = ':';
    static final String UNKNOWN = "unknown";

    private ScopeKeyBuilder() {}

    public static String buildKey(Scope scope, String identifier, String endpoint, String userId) {
        Scope effective = effectiveScope(scope, endpoint, userId);
        if (scope != null && effective != scope) {
            log.debug("scope {} lacks {}, falling back to {}", scope,
                    scope.needsUser() && !StringUtils.hasText(userId) ? "user" : "endpoint", effective);
        }
        String id = StringUtils.hasText(identifier) ? identifier.trim() : UNKNOWN;
        return switch (effective) {
            case GLOBAL -> join(effective);
            case IP -> join(effective, id);
            case USER -> join(effective, userId);
            case ENDPOINT -> join(effective, endpoint);
            case IP_USER -> join(effective, id, userId);
            case IP_ENDPOINT -> join(effective, id, endpoint);
            case USER_ENDPOINT -> join(effective, userId, endpoint);
        };
    }

    public static Scope effectiveScope(Scope scope, String endpoint, String userId) {
        if (scope == null) return Scope.IP;
        if (scope.needsUser() && !StringUtils.hasText(userId)) return Scope.IP;
        if (scope.needsEndpoint() && !StringUtils.hasText(endpoint)) return Scope.IP;
        return scope;
    }

    private static String join(Scope scope, String... parts) {
        StringBuilder sb = new StringBuilder(PREFIX).append(DELIMITER).append(scope.tag());
        for (String p : parts) {
            sb.append(DELIMITER).append(encode(p));
        }
        return sb.toString();
    }

    static String encode(String component) {
        return URLEncoder.encode(component, StandardCharsets.UTF_8);
    }
}
