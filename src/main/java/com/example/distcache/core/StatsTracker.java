package com.example.distcache.core;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * Hit, miss and eviction counters for one cache instance. When tracking is disabled every
 * record call is a no-op and snapshots report zeros.
 */
public class StatsTracker {

    private final boolean enabled;
    private final Clock clock;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private volatile Instant lastResetAt;

    public StatsTracker(boolean enabled, Clock clock) {
        this.enabled = enabled;
        this.clock = clock;
        this.lastResetAt = clock.instant();
    }

    public void recordHit() {
        if (enabled) {
            hits.increment();
        }
    }

    public void recordMiss() {
        if (enabled) {
            misses.increment();
        }
    }

    public void recordEviction() {
        if (enabled) {
            evictions.increment();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public CacheStats snapshot(long size) {
        return snapshot(size, evictions.sum());
    }

    /** Snapshot with an eviction count supplied by the backend itself. */
    public CacheStats snapshot(long size, long backendEvictions) {
        return new CacheStats(size, hits.sum(), misses.sum(), backendEvictions, lastResetAt);
    }

    public void reset() {
        hits.reset();
        misses.reset();
        evictions.reset();
        lastResetAt = clock.instant();
    }
}
