package com.example.distcache.namespace;

import static com.example.distcache.core.CacheArguments.requireEntries;
import static com.example.distcache.core.CacheArguments.requireKey;
import static com.example.distcache.core.CacheArguments.requireKeys;
import static com.example.distcache.core.CacheArguments.requireNamespace;
import static com.example.distcache.core.CacheArguments.requirePattern;

import com.example.distcache.core.Cache;
import com.example.distcache.core.CacheStats;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * View of another {@link Cache} in which every key is stored as {@code namespace:key}. Works over
 * any backend. Nested views compose their prefixes ({@code outer:inner:key}).
 *
 * <p>Stats are those of the shared cache. {@link #close()} does not close it.
 */
public class NamespacedCache implements Cache {

    private final Cache delegate;
    private final String namespace;
    private final String prefix;

    public NamespacedCache(Cache delegate, String namespace) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cache must not be null");
        }
        this.delegate = delegate;
        this.namespace = requireNamespace(namespace);
        this.prefix = namespace + ":";
    }

    public String getNamespace() {
        return namespace;
    }

    @Override
    public Optional<Object> get(String key) {
        return delegate.get(qualify(key));
    }

    @Override
    public void set(String key, Object value) {
        delegate.set(qualify(key), value);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        delegate.set(qualify(key), value, ttl);
    }

    @Override
    public boolean delete(String key) {
        return delegate.delete(qualify(key));
    }

    @Override
    public boolean exists(String key) {
        return delegate.exists(qualify(key));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        return delegate.ttl(qualify(key));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return delegate.expire(qualify(key), ttl);
    }

    @Override
    public void setMany(Map<String, ?> entries) {
        delegate.setMany(qualify(entries));
    }

    @Override
    public void setMany(Map<String, ?> entries, Duration ttl) {
        delegate.setMany(qualify(entries), ttl);
    }

    @Override
    public Map<String, Object> getMany(Collection<String> keys) {
        Map<String, Object> found = delegate.getMany(qualify(keys));
        Map<String, Object> result = new LinkedHashMap<>();
        found.forEach((key, value) -> result.put(strip(key), value));
        return result;
    }

    @Override
    public long deleteMany(Collection<String> keys) {
        return delegate.deleteMany(qualify(keys));
    }

    @Override
    public long increment(String key) {
        return delegate.increment(qualify(key));
    }

    @Override
    public long increment(String key, long delta) {
        return delegate.increment(qualify(key), delta);
    }

    @Override
    public long decrement(String key) {
        return delegate.decrement(qualify(key));
    }

    @Override
    public long decrement(String key, long delta) {
        return delegate.decrement(qualify(key), delta);
    }

    @Override
    public boolean setIfAbsent(String key, Object value) {
        return delegate.setIfAbsent(qualify(key), value);
    }

    @Override
    public boolean setIfAbsent(String key, Object value, Duration ttl) {
        return delegate.setIfAbsent(qualify(key), value, ttl);
    }

    @Override
    public boolean compareAndSwap(String key, Object expected, Object newValue) {
        return delegate.compareAndSwap(qualify(key), expected, newValue);
    }

    @Override
    public Set<String> keysMatching(String pattern) {
        Set<String> keys = new HashSet<>();
        for (String key : delegate.keysMatching(prefix + requirePattern(pattern))) {
            keys.add(strip(key));
        }
        return keys;
    }

    @Override
    public long countMatching(String pattern) {
        return delegate.countMatching(prefix + requirePattern(pattern));
    }

    @Override
    public long deleteMatching(String pattern) {
        return delegate.deleteMatching(prefix + requirePattern(pattern));
    }

    @Override
    public Cache withNamespace(String inner) {
        return new NamespacedCache(delegate, prefix + requireNamespace(inner));
    }

    @Override
    public long clearNamespace(String inner) {
        return delegate.clearNamespace(prefix + requireNamespace(inner));
    }

    @Override
    public CacheStats cacheStats() {
        return delegate.cacheStats();
    }

    @Override
    public void clearStats() {
        delegate.clearStats();
    }

    /** Deletes only the keys of this namespace. */
    @Override
    public long flushAll() {
        return delegate.clearNamespace(namespace);
    }

    @Override
    public boolean ping() {
        return delegate.ping();
    }

    @Override
    public void close() {
        // the delegate is shared with other views
    }

    private String qualify(String key) {
        return prefix + requireKey(key);
    }

    private List<String> qualify(Collection<String> keys) {
        List<String> qualified = new ArrayList<>(requireKeys(keys).size());
        for (String key : keys) {
            qualified.add(prefix + key);
        }
        return qualified;
    }

    private Map<String, Object> qualify(Map<String, ?> entries) {
        Map<String, Object> qualified = new LinkedHashMap<>();
        requireEntries(entries).forEach((key, value) -> qualified.put(prefix + key, value));
        return qualified;
    }

    private String strip(String key) {
        return key.startsWith(prefix) ? key.substring(prefix.length()) : key;
    }

    @Override
    public String toString() {
        return "NamespacedCache{namespace=" + namespace + ", delegate=" + delegate + "}";
    }
}
