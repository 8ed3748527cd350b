package com.mercadolibre.ratelimiter.ratelimit.core;

import java.util.Locale;
import java.util.Optional;

public enum AlgorithmType {
    TOKEN_BUCKET("token_bucket"),
    SLIDING_WINDOW("sliding_window"),
    FIXED_WINDOW("fixed_window");

    private final String id;

    AlgorithmType(String id) {
        this.id = id;
    }

    public String id() { return id; }

    /**
     * Resolves a configured algorithm name. Unknown or blank names fall back to {@link #TOKEN_BUCKET}.
     */
    public static AlgorithmType fromName(String name) {
        return lookup(name).orElse(TOKEN_BUCKET);
    }

    public static Optional<AlgorithmType> lookup(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String n = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (AlgorithmType t : values()) {
            if (t.id.equals(n)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
