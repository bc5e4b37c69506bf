package com.example.distcache.memory;

import com.example.distcache.core.CacheEntry;
import com.example.distcache.core.StatsTracker;
import com.example.distcache.eviction.EvictionStrategy;
import com.example.distcache.pattern.GlobPattern;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyed entry map of the in-process backend.
 *
 * <p>Reads are lock-free. Every change to the map happens under the key's stripe lock together
 * with the matching changes to the eviction strategy and the expiry index, so they never disagree
 * about a key. The raw entry count includes expired entries until they are purged; {@link #size()}
 * and overflow eviction purge expired entries first, so both act on live entries only.
 *
 * <p>All removals (explicit, lazy expiry, sweep, eviction) go through {@link #removeLocked}.
 */
public class EntryStore {

    private static final Logger log = LoggerFactory.getLogger(EntryStore.class);

    /** Expiry deadline of one stored entry, ordered soonest first. */
    private static final class ExpiryMark implements Comparable<ExpiryMark> {
        final long expireAtMillis;
        final String key;

        ExpiryMark(long expireAtMillis, String key) {
            this.expireAtMillis = expireAtMillis;
            this.key = key;
        }

        @Override
        public int compareTo(ExpiryMark other) {
            int byTime = Long.compare(expireAtMillis, other.expireAtMillis);
            return byTime != 0 ? byTime : key.compareTo(other.key);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ExpiryMark)) {
                return false;
            }
            ExpiryMark other = (ExpiryMark) o;
            return expireAtMillis == other.expireAtMillis && key.equals(other.key);
        }

        @Override
        public int hashCode() {
            return Long.hashCode(expireAtMillis) * 31 + key.hashCode();
        }
    }

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    // one mark per stored entry that has an expiry
    private final ConcurrentSkipListSet<ExpiryMark> expiries = new ConcurrentSkipListSet<>();
    private final AtomicInteger count = new AtomicInteger();
    private final AtomicLong accessSequence = new AtomicLong();
    private final KeyLocks locks;
    private final EvictionStrategy evictionStrategy;
    private final StatsTracker stats;
    private final Clock clock;
    private final int maxSize;

    public EntryStore(KeyLocks locks, EvictionStrategy evictionStrategy, StatsTracker stats,
                      Clock clock, int maxSize) {
        this.locks = locks;
        this.evictionStrategy = evictionStrategy;
        this.stats = stats;
        this.clock = clock;
        this.maxSize = maxSize;
    }

    /**
     * Returns the live entry for {@code key} or null. An expired entry is purged on the way.
     *
     * @param touch whether a hit counts as a use for eviction purposes
     */
    public CacheEntry read(String key, boolean touch) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.millis())) {
            purgeIfExpired(key);
            return null;
        }
        if (touch) {
            entry.accessOrder = accessSequence.incrementAndGet();
            evictionStrategy.onAccess(key);
        }
        return entry;
    }

    /**
     * Runs {@code update} against the key's live entry inside the key's exclusive section and
     * commits its outcome before the section is released. Overflow eviction, if needed, runs
     * after the section is released.
     */
    public <T> T update(String key, EntryUpdate<T> update) {
        boolean[] inserted = new boolean[1];
        T result = locks.withLock(key, () -> {
            long now = clock.millis();
            CacheEntry current = entries.get(key);
            boolean expired = current != null && current.isExpired(now);
            Mutation<T> mutation = update.apply(expired ? null : current, now);
            switch (mutation.kind) {
                case WRITE:
                    mutation.replacement.accessOrder = accessSequence.incrementAndGet();
                    CacheEntry previous = entries.put(key, mutation.replacement);
                    if (previous == null) {
                        count.incrementAndGet();
                        inserted[0] = true;
                    }
                    reindex(previous, mutation.replacement);
                    evictionStrategy.onWrite(key);
                    break;
                case RETIME:
                    reindex(entries.put(key, mutation.replacement), mutation.replacement);
                    break;
                case REMOVE:
                    if (current != null) {
                        removeLocked(key, current, expired ? RemovalCause.EXPIRED : RemovalCause.EXPLICIT);
                    }
                    break;
                default:
                    if (expired) {
                        removeLocked(key, current, RemovalCause.EXPIRED);
                    }
                    break;
            }
            return mutation.result;
        });
        if (inserted[0]) {
            evictOverflow();
        }
        return result;
    }

    /** Removes the entry for {@code key} if it has expired. */
    public boolean purgeIfExpired(String key) {
        return locks.withLock(key, () -> {
            CacheEntry entry = entries.get(key);
            if (entry != null && entry.isExpired(clock.millis())) {
                return removeLocked(key, entry, RemovalCause.EXPIRED);
            }
            return false;
        });
    }

    /**
     * Purges every entry whose deadline has passed, soonest first, one key at a time. Only expired
     * entries are visited, so a pass with nothing to purge is cheap.
     */
    public int purgeExpired() {
        long now = clock.millis();
        int purged = 0;
        for (ExpiryMark mark : expiries) {
            if (mark.expireAtMillis > now) {
                break;
            }
            if (purgeIfExpired(mark.key)) {
                purged++;
            }
        }
        return purged;
    }

    /** Live keys matching {@code pattern}. */
    public Set<String> liveKeys(GlobPattern pattern) {
        long now = clock.millis();
        Set<String> keys = new HashSet<>();
        if (pattern.isLiteral()) {
            CacheEntry entry = entries.get(pattern.pattern());
            if (entry != null && !entry.isExpired(now)) {
                keys.add(entry.key);
            }
            return keys;
        }
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (!e.getValue().isExpired(now) && pattern.matches(e.getKey())) {
                keys.add(e.getKey());
            }
        }
        return keys;
    }

    /** Removes every entry and returns how many of them were live. */
    public long clear() {
        List<String> keys = new ArrayList<>(entries.keySet());
        long removed = 0;
        for (String key : keys) {
            Boolean live = update(key, (entry, now) -> Mutation.remove(entry != null));
            if (live) {
                removed++;
            }
        }
        return removed;
    }

    /** Number of live entries. Expired entries are purged before counting. */
    public int size() {
        purgeExpired();
        return count.get();
    }

    Optional<CacheEntry> peekRaw(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    private void evictOverflow() {
        if (maxSize <= 0) {
            return;
        }
        while (count.get() > maxSize) {
            // expired entries make room before any live entry is evicted
            if (purgeExpired() > 0) {
                continue;
            }
            Optional<String> victim = evictionStrategy.selectVictim();
            if (victim.isEmpty()) {
                return;
            }
            String key = victim.get();
            locks.withLock(key, () -> {
                CacheEntry entry = entries.get(key);
                if (entry == null) {
                    // already gone, drop the stale reference
                    evictionStrategy.onRemove(key);
                    return false;
                }
                RemovalCause cause = entry.isExpired(clock.millis()) ? RemovalCause.EXPIRED : RemovalCause.EVICTED;
                return removeLocked(key, entry, cause);
            });
        }
    }

    // caller holds the stripe lock for the entry's key
    private void reindex(CacheEntry previous, CacheEntry replacement) {
        if (previous != null && previous.hasExpiry()) {
            expiries.remove(new ExpiryMark(previous.expireAtMillis, previous.key));
        }
        if (replacement.hasExpiry()) {
            expiries.add(new ExpiryMark(replacement.expireAtMillis, replacement.key));
        }
    }

    // caller holds the stripe lock for key
    private boolean removeLocked(String key, CacheEntry entry, RemovalCause cause) {
        if (!entries.remove(key, entry)) {
            return false;
        }
        count.decrementAndGet();
        if (entry.hasExpiry()) {
            expiries.remove(new ExpiryMark(entry.expireAtMillis, key));
        }
        evictionStrategy.onRemove(key);
        if (cause == RemovalCause.EVICTED) {
            stats.recordEviction();
        }
        if (log.isDebugEnabled()) {
            log.debug("Removed key={} cause={}", key, cause);
        }
        return true;
    }
}
