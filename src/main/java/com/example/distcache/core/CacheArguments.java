package com.example.distcache.core;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Argument checks shared by the backends and the namespace view.
 */
public final class CacheArguments {

    private CacheArguments() {
    }

    public static String requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new CacheValidationException("cache key must not be null or empty");
        }
        return key;
    }

    public static Object requireValue(Object value) {
        if (value == null) {
            throw new CacheValidationException("cache value must not be null");
        }
        return value;
    }

    /** A null TTL is allowed and means "use the default". */
    public static Duration checkTtl(Duration ttl) {
        if (ttl != null && ttl.isNegative()) {
            throw new CacheValidationException("ttl must not be negative: " + ttl);
        }
        return ttl;
    }

    public static Duration requireTtl(Duration ttl) {
        if (ttl == null) {
            throw new CacheValidationException("ttl must not be null");
        }
        return checkTtl(ttl);
    }

    public static String requirePattern(String pattern) {
        if (pattern == null) {
            throw new CacheValidationException("pattern must not be null");
        }
        return pattern;
    }

    public static String requireNamespace(String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            throw new CacheValidationException("namespace must not be null or empty");
        }
        if (namespace.indexOf('*') >= 0 || namespace.indexOf('?') >= 0) {
            throw new CacheValidationException("namespace must not contain glob characters: " + namespace);
        }
        return namespace;
    }

    public static <T extends Collection<String>> T requireKeys(T keys) {
        if (keys == null) {
            throw new CacheValidationException("key collection must not be null");
        }
        keys.forEach(CacheArguments::requireKey);
        return keys;
    }

    public static <T extends Map<String, ?>> T requireEntries(T entries) {
        if (entries == null) {
            throw new CacheValidationException("entry map must not be null");
        }
        entries.forEach((key, value) -> {
            requireKey(key);
            requireValue(value);
        });
        return entries;
    }
}
