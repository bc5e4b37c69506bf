package com.example.distcache.core;

import com.example.distcache.eviction.EvictionPolicy;
import java.time.Duration;

/**
 * Construction-time options. {@code maxSize}, {@code evictionPolicy}, {@code sweepInterval} and
 * {@code lockStripes} only apply to the in-process backend.
 */
public final class CacheSettings {

    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);
    public static final int DEFAULT_LOCK_STRIPES = 64;

    private final Duration defaultTtl;
    private final int maxSize;
    private final EvictionPolicy evictionPolicy;
    private final boolean trackStats;
    private final Duration sweepInterval;
    private final int lockStripes;

    private CacheSettings(Duration defaultTtl, int maxSize, EvictionPolicy evictionPolicy,
                          boolean trackStats, Duration sweepInterval, int lockStripes) {
        if (defaultTtl != null && (defaultTtl.isNegative() || defaultTtl.isZero())) {
            throw new CacheValidationException("defaultTtl must be positive: " + defaultTtl);
        }
        if (maxSize < 0) {
            throw new CacheValidationException("maxSize must not be negative: " + maxSize);
        }
        if (evictionPolicy == null) {
            throw new CacheValidationException("evictionPolicy must not be null");
        }
        if (sweepInterval == null || sweepInterval.isNegative()) {
            throw new CacheValidationException("sweepInterval must not be null or negative: " + sweepInterval);
        }
        if (lockStripes <= 0) {
            throw new CacheValidationException("lockStripes must be positive: " + lockStripes);
        }
        this.defaultTtl = defaultTtl;
        this.maxSize = maxSize;
        this.evictionPolicy = evictionPolicy;
        this.trackStats = trackStats;
        this.sweepInterval = sweepInterval;
        this.lockStripes = lockStripes;
    }

    /** No default TTL, unbounded, LRU, stats on, 60s sweep. */
    public static CacheSettings defaults() {
        return new CacheSettings(null, 0, EvictionPolicy.LRU, true, DEFAULT_SWEEP_INTERVAL, DEFAULT_LOCK_STRIPES);
    }

    public CacheSettings withDefaultTtl(Duration ttl) {
        return new CacheSettings(ttl, maxSize, evictionPolicy, trackStats, sweepInterval, lockStripes);
    }

    public CacheSettings withMaxSize(int size) {
        return new CacheSettings(defaultTtl, size, evictionPolicy, trackStats, sweepInterval, lockStripes);
    }

    public CacheSettings withEvictionPolicy(EvictionPolicy policy) {
        return new CacheSettings(defaultTtl, maxSize, policy, trackStats, sweepInterval, lockStripes);
    }

    public CacheSettings withTrackStats(boolean track) {
        return new CacheSettings(defaultTtl, maxSize, evictionPolicy, track, sweepInterval, lockStripes);
    }

    /** {@link Duration#ZERO} disables the background sweep. */
    public CacheSettings withSweepInterval(Duration interval) {
        return new CacheSettings(defaultTtl, maxSize, evictionPolicy, trackStats, interval, lockStripes);
    }

    public CacheSettings withLockStripes(int stripes) {
        return new CacheSettings(defaultTtl, maxSize, evictionPolicy, trackStats, sweepInterval, stripes);
    }

    /** May be null. */
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public boolean isEvictionEnabled() {
        return maxSize > 0;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    public boolean isTrackStats() {
        return trackStats;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public int getLockStripes() {
        return lockStripes;
    }

    @Override
    public String toString() {
        return "CacheSettings{defaultTtl=" + defaultTtl + ", maxSize=" + maxSize + ", evictionPolicy=" + evictionPolicy
            + ", trackStats=" + trackStats + ", sweepInterval=" + sweepInterval + ", lockStripes=" + lockStripes + "}";
    }
}
