package com.mercadolibre.ratelimiter.ratelimit.list;

import com.mercadolibre.ratelimiter.ratelimit.core.ScopeKeyBuilder;

public enum ListKind {
    ALLOW("whitelist"),
    DENY("blacklist");

    private final String namespace;

    ListKind(String namespace) {
        this.namespace = namespace;
    }

    public String namespace() { return namespace; }

    String keyPrefix() {
        return ScopeKeyBuilder.PREFIX + ScopeKeyBuilder.DELIMITER + namespace + ScopeKeyBuilder.DELIMITER;
    }

    String key(String identifier) {
        return keyPrefix() + identifier;
    }
}
