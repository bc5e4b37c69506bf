package com.example.distcache.memory;

import static com.example.distcache.core.CacheArguments.checkTtl;
import static com.example.distcache.core.CacheArguments.requireEntries;
import static com.example.distcache.core.CacheArguments.requireKey;
import static com.example.distcache.core.CacheArguments.requireKeys;
import static com.example.distcache.core.CacheArguments.requireTtl;
import static com.example.distcache.core.CacheArguments.requireValue;

import com.example.distcache.core.Cache;
import com.example.distcache.core.CacheEntry;
import com.example.distcache.core.CacheSettings;
import com.example.distcache.core.CacheStats;
import com.example.distcache.core.CacheValidationException;
import com.example.distcache.core.CacheValues;
import com.example.distcache.core.StatsTracker;
import com.example.distcache.namespace.NamespacedCache;
import com.example.distcache.pattern.GlobPattern;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link Cache}. Entries live in an {@link EntryStore}; read-modify-write operations
 * run inside the key's stripe lock, so increments, set-if-absent and compare-and-swap are
 * linearizable per key. Expired entries are dropped when read and by a background
 * {@link ExpirySweeper}.
 */
public class InMemoryCache implements Cache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCache.class);

    private final CacheSettings settings;
    private final Clock clock;
    private final StatsTracker stats;
    private final EntryStore store;
    private final ExpirySweeper sweeper;
    private final AtomicBoolean closed = new AtomicBoolean();

    public InMemoryCache() {
        this(CacheSettings.defaults());
    }

    public InMemoryCache(CacheSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public InMemoryCache(CacheSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.stats = new StatsTracker(settings.isTrackStats(), clock);
        this.store = new EntryStore(new KeyLocks(settings.getLockStripes()),
            settings.getEvictionPolicy().newStrategy(), stats, clock, settings.getMaxSize());
        Duration interval = settings.getSweepInterval();
        this.sweeper = interval.isZero() ? null : new ExpirySweeper(store, interval);
        log.info("In-memory cache created: {}", settings);
    }

    @Override
    public Optional<Object> get(String key) {
        ensureOpen();
        CacheEntry entry = store.read(requireKey(key), true);
        if (entry == null) {
            stats.recordMiss();
            return Optional.empty();
        }
        stats.recordHit();
        return Optional.of(entry.value);
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, null);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        ensureOpen();
        requireKey(key);
        requireValue(value);
        Duration effective = effectiveTtl(checkTtl(ttl));
        store.update(key, (live, now) -> {
            if (effective != null && effective.isZero()) {
                return Mutation.remove(null);
            }
            long version = live == null ? 1 : live.version + 1;
            return Mutation.write(new CacheEntry(key, value, expireAt(now, effective), now, version, 0), null);
        });
    }

    @Override
    public boolean delete(String key) {
        ensureOpen();
        return store.update(requireKey(key), (live, now) -> Mutation.remove(live != null));
    }

    @Override
    public boolean exists(String key) {
        ensureOpen();
        return store.read(requireKey(key), false) != null;
    }

    @Override
    public Optional<Duration> ttl(String key) {
        ensureOpen();
        CacheEntry entry = store.read(requireKey(key), false);
        if (entry == null || !entry.hasExpiry()) {
            return Optional.empty();
        }
        long remaining = entry.expireAtMillis - clock.millis();
        return Optional.of(Duration.ofMillis(Math.max(remaining, 1)));
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        ensureOpen();
        requireKey(key);
        requireTtl(ttl);
        return store.update(key, (live, now) -> {
            if (live == null) {
                return Mutation.keep(false);
            }
            if (ttl.isZero()) {
                return Mutation.remove(true);
            }
            return Mutation.retime(live.withExpireAt(now + ttl.toMillis()), true);
        });
    }

    @Override
    public void setMany(Map<String, ?> entries) {
        setMany(entries, null);
    }

    @Override
    public void setMany(Map<String, ?> entries, Duration ttl) {
        ensureOpen();
        requireEntries(entries);
        checkTtl(ttl);
        entries.forEach((key, value) -> set(key, value, ttl));
    }

    @Override
    public Map<String, Object> getMany(Collection<String> keys) {
        ensureOpen();
        Map<String, Object> found = new LinkedHashMap<>();
        for (String key : requireKeys(keys)) {
            get(key).ifPresent(value -> found.put(key, value));
        }
        return found;
    }

    @Override
    public long deleteMany(Collection<String> keys) {
        ensureOpen();
        long deleted = 0;
        for (String key : requireKeys(keys)) {
            if (delete(key)) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public long increment(String key) {
        return increment(key, 1);
    }

    @Override
    public long increment(String key, long delta) {
        ensureOpen();
        requireKey(key);
        return store.update(key, (live, now) -> {
            if (live == null) {
                return Mutation.write(new CacheEntry(key, delta, CacheEntry.NO_EXPIRY, now, 1, 0), delta);
            }
            long next = CacheValues.addExact(key, CacheValues.asCounter(key, live.value), delta);
            return Mutation.write(live.withValue(next, 0), next);
        });
    }

    @Override
    public long decrement(String key) {
        return decrement(key, 1);
    }

    @Override
    public long decrement(String key, long delta) {
        if (delta == Long.MIN_VALUE) {
            throw new CacheValidationException("decrement delta out of range: " + delta);
        }
        return increment(key, -delta);
    }

    @Override
    public boolean setIfAbsent(String key, Object value) {
        return setIfAbsent(key, value, null);
    }

    @Override
    public boolean setIfAbsent(String key, Object value, Duration ttl) {
        ensureOpen();
        requireKey(key);
        requireValue(value);
        Duration effective = effectiveTtl(checkTtl(ttl));
        return store.update(key, (live, now) -> {
            if (live != null) {
                return Mutation.keep(false);
            }
            if (effective != null && effective.isZero()) {
                // set and immediately expired: nothing observable remains
                return Mutation.keep(true);
            }
            return Mutation.write(new CacheEntry(key, value, expireAt(now, effective), now, 1, 0), true);
        });
    }

    @Override
    public boolean compareAndSwap(String key, Object expected, Object newValue) {
        ensureOpen();
        requireKey(key);
        requireValue(newValue);
        Duration defaultTtl = settings.getDefaultTtl();
        return store.update(key, (live, now) -> {
            if (expected == null) {
                if (live != null) {
                    return Mutation.keep(false);
                }
                return Mutation.write(new CacheEntry(key, newValue, expireAt(now, defaultTtl), now, 1, 0), true);
            }
            if (live == null || !CacheValues.sameValue(live.value, expected)) {
                return Mutation.keep(false);
            }
            return Mutation.write(live.withValue(newValue, 0), true);
        });
    }

    @Override
    public Set<String> keysMatching(String pattern) {
        ensureOpen();
        return store.liveKeys(GlobPattern.compile(pattern));
    }

    @Override
    public long countMatching(String pattern) {
        return keysMatching(pattern).size();
    }

    @Override
    public long deleteMatching(String pattern) {
        return deleteMany(keysMatching(pattern));
    }

    @Override
    public Cache withNamespace(String namespace) {
        ensureOpen();
        return new NamespacedCache(this, namespace);
    }

    @Override
    public long clearNamespace(String namespace) {
        return deleteMatching(GlobPattern.namespace(namespace).pattern());
    }

    @Override
    public CacheStats cacheStats() {
        return stats.snapshot(store.size());
    }

    @Override
    public void clearStats() {
        stats.reset();
    }

    @Override
    public long flushAll() {
        ensureOpen();
        long removed = store.clear();
        log.info("Flushed {} entries", removed);
        return removed;
    }

    @Override
    public boolean ping() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (sweeper != null) {
            sweeper.close();
        }
        store.clear();
        log.info("In-memory cache closed");
    }

    public CacheSettings getSettings() {
        return settings;
    }

    EntryStore store() {
        return store;
    }

    ExpirySweeper sweeper() {
        return sweeper;
    }

    private Duration effectiveTtl(Duration ttl) {
        return ttl != null ? ttl : settings.getDefaultTtl();
    }

    private static long expireAt(long now, Duration ttl) {
        return ttl == null ? CacheEntry.NO_EXPIRY : now + ttl.toMillis();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("cache is closed");
        }
    }
}
