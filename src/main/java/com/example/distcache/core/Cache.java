package com.example.distcache.core;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Key-value cache contract shared by every backend.
 *
 * <p>Misses and failed compare-and-swap attempts are ordinary return values. Only malformed
 * input ({@link CacheValidationException}) and backend unavailability
 * ({@link CacheConnectionException}) are raised.
 *
 * <p>Glob patterns accepted by the pattern operations support {@code *} (any run of characters,
 * possibly empty) and {@code ?} (exactly one character). Matching is case-sensitive and anchored
 * to the whole key.
 */
public interface Cache extends AutoCloseable {

    /** Returns the live value for {@code key}, or empty when missing or expired. */
    Optional<Object> get(String key);

    /** Stores {@code value} with the configured default TTL. */
    void set(String key, Object value);

    /**
     * Stores {@code value}, replacing any previous entry.
     *
     * @param ttl time to live, or {@code null} for the configured default
     */
    void set(String key, Object value, Duration ttl);

    /** Returns true iff a live entry existed and was removed. */
    boolean delete(String key);

    boolean exists(String key);

    /** Remaining time to live; empty if the key is absent or never expires. */
    Optional<Duration> ttl(String key);

    /** Resets the TTL of a live key without touching its value. Returns false if absent. */
    boolean expire(String key, Duration ttl);

    void setMany(Map<String, ?> entries);

    void setMany(Map<String, ?> entries, Duration ttl);

    /** Returns the live values for {@code keys}; absent keys are omitted. */
    Map<String, Object> getMany(Collection<String> keys);

    long deleteMany(Collection<String> keys);

    long increment(String key);

    /**
     * Atomically adds {@code delta} to the integer stored at {@code key}, creating it at
     * {@code delta} when absent.
     *
     * @return the value after the increment
     */
    long increment(String key, long delta);

    long decrement(String key);

    long decrement(String key, long delta);

    boolean setIfAbsent(String key, Object value);

    /**
     * Stores {@code value} only if no live entry exists for {@code key}. Of several concurrent
     * callers exactly one wins.
     */
    boolean setIfAbsent(String key, Object value, Duration ttl);

    /**
     * Replaces the value at {@code key} with {@code newValue} iff the current value equals
     * {@code expected}. A {@code null} expectation means the key must be absent. The remaining
     * TTL of a replaced entry is kept.
     */
    boolean compareAndSwap(String key, Object expected, Object newValue);

    Set<String> keysMatching(String pattern);

    long countMatching(String pattern);

    long deleteMatching(String pattern);

    /** Returns a view of this cache whose keys live under {@code namespace + ":"}. */
    Cache withNamespace(String namespace);

    /** Deletes every key under {@code namespace + ":"}. */
    long clearNamespace(String namespace);

    CacheStats cacheStats();

    void clearStats();

    /** Removes every key visible through this cache and returns how many were removed. */
    long flushAll();

    /** Checks backend reachability. Never throws. */
    boolean ping();

    /** Releases backend resources. Calling it more than once has no further effect. */
    @Override
    void close();
}
