package com.mercadolibre.ratelimiter.ratelimit.core;

import java.util.Locale;

public enum Scope {
    GLOBAL("global"),
    IP("ip"),
    USER("user"),
    ENDPOINT("endpoint"),
    IP_USER("ip_user"),
    IP_ENDPOINT("ip_endpoint"),
    USER_ENDPOINT("user_endpoint");

    private final String tag;

    Scope(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    public boolean needsUser() {
        return this == USER || this == IP_USER || this == USER_ENDPOINT;
    }

    public boolean needsEndpoint() {
        return this == ENDPOINT || this == IP_ENDPOINT || this == USER_ENDPOINT;
    }

    /** Accepts the key tag ({@code ip_user}) or the constant name ({@code IP_USER}). */
    public static Scope from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("scope is required");
        }
        String v = value.trim();
        for (Scope s : values()) {
            if (s.tag.equals(v) || s.name().equals(v.toUpperCase(Locale.ROOT))) return s;
        }
        throw new IllegalArgumentException("unknown scope: " + value);
    }
}
