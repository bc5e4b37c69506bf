package com.example.distcache.redis;

import static com.example.distcache.core.CacheArguments.checkTtl;
import static com.example.distcache.core.CacheArguments.requireEntries;
import static com.example.distcache.core.CacheArguments.requireKey;
import static com.example.distcache.core.CacheArguments.requireKeys;
import static com.example.distcache.core.CacheArguments.requireTtl;
import static com.example.distcache.core.CacheArguments.requireValue;

import com.example.distcache.core.Cache;
import com.example.distcache.core.CacheConnectionException;
import com.example.distcache.core.CacheException;
import com.example.distcache.core.CachePoolExhaustedException;
import com.example.distcache.core.CacheSettings;
import com.example.distcache.core.CacheStats;
import com.example.distcache.core.CacheValidationException;
import com.example.distcache.core.StatsTracker;
import com.example.distcache.namespace.NamespacedCache;
import com.example.distcache.pattern.GlobPattern;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.SetParams;
import redis.clients.jedis.resps.ScanResult;

/**
 * {@link Cache} backed by Redis through a Jedis pool.
 *
 * <p>Atomic operations run on the server (SET NX, and Lua scripts around INCRBY and
 * compare-and-swap), so no client-side lock is ever held across a network call. Failing to borrow a connection is
 * retried up to {@link RedisSettings#getMaxAttempts()} times; a command that fails mid-flight is
 * not retried, since it may already have been applied.
 */
public class RedisCache implements Cache {

    private static final Logger log = LoggerFactory.getLogger(RedisCache.class);

    static final int SCAN_BATCH = 100;

    /** KEYS[1] key, ARGV[1] expected encoding, ARGV[2] new encoding. Keeps the remaining TTL. */
    static final String COMPARE_AND_SWAP_SCRIPT =
        "local current = redis.call('GET', KEYS[1])\n"
            + "if current ~= ARGV[1] then return 0 end\n"
            + "local ttl = redis.call('PTTL', KEYS[1])\n"
            + "if ttl > 0 then\n"
            + "  redis.call('SET', KEYS[1], ARGV[2], 'PX', ttl)\n"
            + "else\n"
            + "  redis.call('SET', KEYS[1], ARGV[2])\n"
            + "end\n"
            + "return 1";

    /**
     * KEYS[1] key, ARGV[1] delta. A numeric string stored as JSON text is first rewritten as a bare
     * integer (keeping its TTL) so INCRBY accepts it. Longer digit runs are left alone, so an
     * out-of-range value is rejected by INCRBY without being rewritten.
     */
    static final String INCREMENT_SCRIPT =
        "local current = redis.call('GET', KEYS[1])\n"
            + "if current then\n"
            + "  local digits = string.match(current, '^\"(%-?%d+)\"$')\n"
            + "  if digits and #digits < 19 then\n"
            + "    local ttl = redis.call('PTTL', KEYS[1])\n"
            + "    if ttl > 0 then\n"
            + "      redis.call('SET', KEYS[1], digits, 'PX', ttl)\n"
            + "    else\n"
            + "      redis.call('SET', KEYS[1], digits)\n"
            + "    end\n"
            + "  end\n"
            + "end\n"
            + "return redis.call('INCRBY', KEYS[1], ARGV[1])";

    private final JedisPool pool;
    private final RedisSettings settings;
    private final CacheSettings cacheSettings;
    private final RedisValueCodec codec;
    private final StatsTracker stats;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile long evictionBaseline;

    public RedisCache(JedisPool pool, RedisSettings settings, CacheSettings cacheSettings,
                      ObjectMapper mapper, Clock clock) {
        this.pool = pool;
        this.settings = settings;
        this.cacheSettings = cacheSettings;
        this.codec = new RedisValueCodec(mapper);
        this.stats = new StatsTracker(cacheSettings.isTrackStats(), clock);
    }

    /** Creates a pool from {@code settings} and a cache that owns it. */
    public static RedisCache connect(RedisSettings settings, CacheSettings cacheSettings, ObjectMapper mapper) {
        return new RedisCache(RedisPools.create(settings), settings, cacheSettings, mapper, Clock.systemUTC());
    }

    @Override
    public Optional<Object> get(String key) {
        requireKey(key);
        String json = execute(jedis -> jedis.get(key));
        if (json == null) {
            stats.recordMiss();
            return Optional.empty();
        }
        stats.recordHit();
        return Optional.of(codec.decode(json));
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, null);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        requireKey(key);
        String json = codec.encode(requireValue(value));
        Duration effective = effectiveTtl(checkTtl(ttl));
        if (effective == null) {
            execute(jedis -> jedis.set(key, json));
        } else if (effective.isZero()) {
            execute(jedis -> jedis.del(key));
        } else {
            execute(jedis -> jedis.psetex(key, effective.toMillis(), json));
        }
    }

    @Override
    public boolean delete(String key) {
        requireKey(key);
        return execute(jedis -> jedis.del(key)) > 0;
    }

    @Override
    public boolean exists(String key) {
        requireKey(key);
        return execute(jedis -> jedis.exists(key));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        requireKey(key);
        long millis = execute(jedis -> jedis.pttl(key));
        // -2 absent, -1 no expiry
        return millis > 0 ? Optional.of(Duration.ofMillis(millis)) : Optional.empty();
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        requireKey(key);
        requireTtl(ttl);
        if (ttl.isZero()) {
            return delete(key);
        }
        return execute(jedis -> jedis.pexpire(key, ttl.toMillis())) == 1L;
    }

    @Override
    public void setMany(Map<String, ?> entries) {
        setMany(entries, null);
    }

    @Override
    public void setMany(Map<String, ?> entries, Duration ttl) {
        requireEntries(entries);
        if (entries.isEmpty()) {
            return;
        }
        Duration effective = effectiveTtl(checkTtl(ttl));
        Map<String, String> encoded = new LinkedHashMap<>();
        entries.forEach((key, value) -> encoded.put(key, codec.encode(value)));
        execute(jedis -> {
            Pipeline pipeline = jedis.pipelined();
            encoded.forEach((key, json) -> {
                if (effective == null) {
                    pipeline.set(key, json);
                } else if (effective.isZero()) {
                    pipeline.del(key);
                } else {
                    pipeline.psetex(key, effective.toMillis(), json);
                }
            });
            pipeline.sync();
            return encoded.size();
        });
    }

    @Override
    public Map<String, Object> getMany(Collection<String> keys) {
        List<String> ordered = new ArrayList<>(requireKeys(keys));
        Map<String, Object> found = new LinkedHashMap<>();
        if (ordered.isEmpty()) {
            return found;
        }
        List<String> values = execute(jedis -> jedis.mget(ordered.toArray(new String[0])));
        for (int i = 0; i < ordered.size(); i++) {
            String json = values.get(i);
            if (json == null) {
                stats.recordMiss();
            } else {
                stats.recordHit();
                found.put(ordered.get(i), codec.decode(json));
            }
        }
        return found;
    }

    @Override
    public long deleteMany(Collection<String> keys) {
        requireKeys(keys);
        if (keys.isEmpty()) {
            return 0;
        }
        String[] array = keys.toArray(new String[0]);
        return execute(jedis -> jedis.del(array));
    }

    @Override
    public long increment(String key) {
        return increment(key, 1);
    }

    @Override
    public long increment(String key, long delta) {
        requireKey(key);
        Object result = execute(jedis ->
            jedis.eval(INCREMENT_SCRIPT, List.of(key), List.of(Long.toString(delta))));
        return ((Number) result).longValue();
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
        requireKey(key);
        String json = codec.encode(requireValue(value));
        Duration effective = effectiveTtl(checkTtl(ttl));
        if (effective != null && effective.isZero()) {
            return !exists(key);
        }
        SetParams params = SetParams.setParams().nx();
        if (effective != null) {
            params.px(effective.toMillis());
        }
        return "OK".equals(execute(jedis -> jedis.set(key, json, params)));
    }

    @Override
    public boolean compareAndSwap(String key, Object expected, Object newValue) {
        requireKey(key);
        requireValue(newValue);
        if (expected == null) {
            return setIfAbsent(key, newValue);
        }
        String expectedJson = codec.encode(expected);
        String newJson = codec.encode(newValue);
        Object result = execute(jedis ->
            jedis.eval(COMPARE_AND_SWAP_SCRIPT, List.of(key), List.of(expectedJson, newJson)));
        return Long.valueOf(1L).equals(result);
    }

    @Override
    public Set<String> keysMatching(String pattern) {
        GlobPattern glob = GlobPattern.compile(pattern);
        ScanParams params = new ScanParams().match(glob.toRedisPattern()).count(SCAN_BATCH);
        return execute(jedis -> {
            Set<String> keys = new HashSet<>();
            String cursor = ScanParams.SCAN_POINTER_START;
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                keys.addAll(page.getResult());
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            return keys;
        });
    }

    @Override
    public long countMatching(String pattern) {
        return keysMatching(pattern).size();
    }

    @Override
    public long deleteMatching(String pattern) {
        List<String> keys = new ArrayList<>(keysMatching(pattern));
        long deleted = 0;
        for (int from = 0; from < keys.size(); from += SCAN_BATCH) {
            deleted += deleteMany(keys.subList(from, Math.min(from + SCAN_BATCH, keys.size())));
        }
        return deleted;
    }

    @Override
    public Cache withNamespace(String namespace) {
        return new NamespacedCache(this, namespace);
    }

    @Override
    public long clearNamespace(String namespace) {
        return deleteMatching(GlobPattern.namespace(namespace).pattern());
    }

    @Override
    public CacheStats cacheStats() {
        long size = execute(jedis -> jedis.dbSize());
        long evictions = stats.isEnabled() ? Math.max(0, serverEvictions() - evictionBaseline) : 0;
        return stats.snapshot(size, evictions);
    }

    @Override
    public void clearStats() {
        stats.reset();
        evictionBaseline = serverEvictions();
    }

    @Override
    public long flushAll() {
        return execute(jedis -> {
            long size = jedis.dbSize();
            jedis.flushDB();
            return size;
        });
    }

    @Override
    public boolean ping() {
        try {
            return "PONG".equals(execute(jedis -> jedis.ping()));
        } catch (CacheException | IllegalStateException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            pool.close();
            log.info("Redis cache closed ({})", settings.address());
        }
    }

    private long serverEvictions() {
        return parseEvictedKeys(execute(jedis -> jedis.info("stats")));
    }

    static long parseEvictedKeys(String info) {
        if (info == null) {
            return 0;
        }
        for (String line : info.split("\r?\n")) {
            if (line.startsWith("evicted_keys:")) {
                try {
                    return Long.parseLong(line.substring("evicted_keys:".length()).trim());
                } catch (NumberFormatException e) {
                    log.warn("Unparseable evicted_keys line: {}", line);
                    return 0;
                }
            }
        }
        return 0;
    }

    private Duration effectiveTtl(Duration ttl) {
        return ttl != null ? ttl : cacheSettings.getDefaultTtl();
    }

    private <T> T execute(Function<Jedis, T> command) {
        if (closed.get()) {
            throw new IllegalStateException("cache is closed");
        }
        try (Jedis jedis = borrow()) {
            return command.apply(jedis);
        } catch (JedisConnectionException e) {
            throw new CacheConnectionException("redis command failed at " + settings.address() + ": " + e.getMessage(), e);
        } catch (JedisDataException e) {
            throw new CacheValidationException("redis rejected command: " + e.getMessage(), e);
        } catch (JedisException e) {
            throw new CacheException("redis command failed: " + e.getMessage(), e);
        }
    }

    private Jedis borrow() {
        int maxAttempts = settings.getMaxAttempts();
        CacheConnectionException failure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return pool.getResource();
            } catch (JedisConnectionException e) {
                failure = new CacheConnectionException("cannot connect to redis at " + settings.address(), e);
            } catch (JedisException e) {
                if (!(e.getCause() instanceof NoSuchElementException)) {
                    throw new CacheException("cannot obtain redis connection: " + e.getMessage(), e);
                }
                failure = new CachePoolExhaustedException("redis pool exhausted after waiting "
                    + settings.getConnectTimeout(), e);
            }
            if (attempt < maxAttempts) {
                log.warn("Redis connection attempt {}/{} failed: {}", attempt, maxAttempts, failure.getMessage());
                backOff(failure);
            }
        }
        throw failure;
    }

    private void backOff(CacheConnectionException failure) {
        try {
            Thread.sleep(settings.getRetryBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "RedisCache{" + settings.address() + "}";
    }
}
