package com.example.distcache.core;

import java.time.Instant;

/**
 * Immutable snapshot of a cache's counters.
 */
public final class CacheStats {

    private final long size;
    private final long hits;
    private final long misses;
    private final long evictions;
    private final Instant lastResetAt;

    public CacheStats(long size, long hits, long misses, long evictions, Instant lastResetAt) {
        this.size = size;
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.lastResetAt = lastResetAt;
    }

    public long getSize() {
        return size;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getEvictions() {
        return evictions;
    }

    public Instant getLastResetAt() {
        return lastResetAt;
    }

    /** Fraction of reads that were hits, 0.0 before any read. */
    public double getHitRate() {
        long requests = hits + misses;
        return requests == 0 ? 0.0 : (double) hits / requests;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{size=%d, hits=%d, misses=%d, hitRate=%.3f, evictions=%d, lastResetAt=%s}",
            size, hits, misses, getHitRate(), evictions, lastResetAt);
    }
}
