package com.emissions.model;

/**
 * Namespaced identity of a cached query result, {@code <namespace>:<sha256-hex>}.
 * Record equality makes it safe as a map key.
 */
public record CacheKey(String value) {

    public static final char SEPARATOR = ':';

    public CacheKey {
        if (value == null || value.indexOf(SEPARATOR) < 1) {
            throw new IllegalArgumentException("Cache key must be <namespace>:<digest>, got " + value);
        }
    }

    public static CacheKey of(String namespace, String digest) {
        return new CacheKey(namespace + SEPARATOR + digest);
    }

    public String namespace() {
        return value.substring(0, value.indexOf(SEPARATOR));
    }

    public String digest() {
        return value.substring(value.indexOf(SEPARATOR) + 1);
    }

    @Override
    public String toString() {
        return value;
    }
}
