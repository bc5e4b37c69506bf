package com.example.distcache.core;

/**
 * A stored value plus the bookkeeping the in-process backend needs. Entries are replaced
 * wholesale on writes; only {@link #accessOrder} changes in place.
 */
public class CacheEntry {

    public static final long NO_EXPIRY = 0L;

    public final String key;
    public final Object value;
    public final long expireAtMillis;   // absolute epoch millis, NO_EXPIRY when the entry never expires
    public final long insertedAtMillis;
    public final long version;
    public volatile long accessOrder;   // refreshed on every touch

    public CacheEntry(String key, Object value, long expireAtMillis, long insertedAtMillis,
                      long version, long accessOrder) {
        this.key = key;
        this.value = value;
        this.expireAtMillis = expireAtMillis;
        this.insertedAtMillis = insertedAtMillis;
        this.version = version;
        this.accessOrder = accessOrder;
    }

    public boolean hasExpiry() {
        return expireAtMillis != NO_EXPIRY;
    }

    public boolean isExpired(long nowMillis) {
        return hasExpiry() && expireAtMillis <= nowMillis;
    }

    /** Same value and version, new expiry. */
    public CacheEntry withExpireAt(long newExpireAtMillis) {
        return new CacheEntry(key, value, newExpireAtMillis, insertedAtMillis, version, accessOrder);
    }

    /** New value, version bumped, expiry kept. */
    public CacheEntry withValue(Object newValue, long order) {
        return new CacheEntry(key, newValue, expireAtMillis, insertedAtMillis, version + 1, order);
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", version=" + version + ", expireAt=" + expireAtMillis + "}";
    }
}
