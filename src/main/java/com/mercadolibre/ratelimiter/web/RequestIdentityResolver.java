package com.mercadolibre.ratelimiter.web;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.util.StringUtils;

import java.net.InetSocketAddress;

/**
 * Extracts the caller identity used for limiting: the client IP and, for bearer-authenticated calls,
 * a user id taken from the token prefix.
 */
public class RequestIdentityResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String REAL_IP = "X-Real-IP";
    private static final String BEARER = "Bearer ";
    private static final String UNKNOWN = "unknown";

    private final int userIdLength;

    public RequestIdentityResolver(int userIdLength) {
        if (userIdLength < 1) throw new IllegalArgumentException("userIdLength must be > 0");
        this.userIdLength = userIdLength;
    }

    public String clientIp(ServerHttpRequest request) {
        HttpHeaders h = request.getHeaders();

        String forwarded = h.getFirst(FORWARDED_FOR);
        if (StringUtils.hasText(forwarded)) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) return first;
        }

        String realIp = h.getFirst(REAL_IP);
        if (StringUtils.hasText(realIp)) return realIp.trim();

        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null) {
            return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
        }
        return UNKNOWN;
    }

    /** Null when the request carries no bearer token. */
    public String userId(ServerHttpRequest request) {
        String auth = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith(BEARER)) return null;
        String token = auth.substring(BEARER.length()).trim();
        if (token.isEmpty()) return null;
        return token.length() > userIdLength ? token.substring(0, userIdLength) : token;
    }
}
