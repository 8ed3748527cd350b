package com.mercadolibre.ratelimiter.ratelimit.list;

/**
 * @param ttlSeconds seconds until the entry expires, {@code null} for permanent entries
 */
public record AccessListEntry(String identifier, Long ttlSeconds) {}
