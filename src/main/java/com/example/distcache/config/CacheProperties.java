package com.example.distcache.config;

import com.example.distcache.core.CacheSettings;
import com.example.distcache.eviction.EvictionPolicy;
import com.example.distcache.redis.RedisSettings;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    public enum Backend { MEMORY, REDIS }

    private Backend backend = Backend.MEMORY;

    /** Applied when a write omits its TTL. Unset means entries never expire by default. */
    private Duration defaultTtl;

    /** Maximum entries of the in-process backend; 0 disables eviction. */
    private int maxSize = 0;

    private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;

    private boolean trackStats = true;

    /** Interval of the background expiry sweep; 0 disables it. */
    private Duration sweepInterval = CacheSettings.DEFAULT_SWEEP_INTERVAL;

    private int lockStripes = CacheSettings.DEFAULT_LOCK_STRIPES;

    private final Redis redis = new Redis();

    public CacheSettings toSettings() {
        return CacheSettings.defaults()
            .withDefaultTtl(defaultTtl)
            .withMaxSize(maxSize)
            .withEvictionPolicy(evictionPolicy)
            .withTrackStats(trackStats)
            .withSweepInterval(sweepInterval)
            .withLockStripes(lockStripes);
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    public void setEvictionPolicy(EvictionPolicy evictionPolicy) {
        this.evictionPolicy = evictionPolicy;
    }

    public boolean isTrackStats() {
        return trackStats;
    }

    public void setTrackStats(boolean trackStats) {
        this.trackStats = trackStats;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public int getLockStripes() {
        return lockStripes;
    }

    public void setLockStripes(int lockStripes) {
        this.lockStripes = lockStripes;
    }

    public Redis getRedis() {
        return redis;
    }

    public static class Redis {

        private String host = "localhost";
        private int port = 6379;
        private String password;
        private int database = 0;
        private Duration connectTimeout = Duration.ofSeconds(2);
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(100);
        private final Pool pool = new Pool();

        public RedisSettings toSettings() {
            return RedisSettings.builder()
                .host(host)
                .port(port)
                .password(password)
                .database(database)
                .connectTimeout(connectTimeout)
                .pool(pool.getMaxTotal(), pool.getMaxIdle(), pool.getMinIdle())
                .maxAttempts(maxAttempts)
                .retryBackoff(retryBackoff)
                .build();
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getDatabase() {
            return database;
        }

        public void setDatabase(int database) {
            this.database = database;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Pool getPool() {
            return pool;
        }
    }

    public static class Pool {

        private int maxTotal = 20;
        private int maxIdle = 10;
        private int minIdle = 2;

        public int getMaxTotal() {
            return maxTotal;
        }

        public void setMaxTotal(int maxTotal) {
            this.maxTotal = maxTotal;
        }

        public int getMaxIdle() {
            return maxIdle;
        }

        public void setMaxIdle(int maxIdle) {
            this.maxIdle = maxIdle;
        }

        public int getMinIdle() {
            return minIdle;
        }

        public void setMinIdle(int minIdle) {
            this.minIdle = minIdle;
        }
    }
}
