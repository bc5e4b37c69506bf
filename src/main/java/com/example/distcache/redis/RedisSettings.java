package com.example.distcache.redis;

import com.example.distcache.core.CacheValidationException;
import java.time.Duration;

/**
 * Connection and pool options of the Redis backend.
 */
public final class RedisSettings {

    private final String host;
    private final int port;
    private final String password;
    private final int database;
    private final Duration connectTimeout;
    private final int maxTotal;
    private final int maxIdle;
    private final int minIdle;
    private final int maxAttempts;
    private final Duration retryBackoff;

    private RedisSettings(Builder b) {
        if (b.host == null || b.host.isBlank()) {
            throw new CacheValidationException("redis host must not be blank");
        }
        if (b.port < 1 || b.port > 65535) {
            throw new CacheValidationException("redis port out of range: " + b.port);
        }
        if (b.database < 0) {
            throw new CacheValidationException("redis database index must not be negative: " + b.database);
        }
        if (b.connectTimeout == null || b.connectTimeout.isNegative() || b.connectTimeout.isZero()) {
            throw new CacheValidationException("connectTimeout must be positive: " + b.connectTimeout);
        }
        if (b.maxTotal < 1 || b.maxIdle < 0 || b.minIdle < 0 || b.minIdle > b.maxIdle || b.maxIdle > b.maxTotal) {
            throw new CacheValidationException("inconsistent pool bounds: maxTotal=" + b.maxTotal
                + ", maxIdle=" + b.maxIdle + ", minIdle=" + b.minIdle);
        }
        if (b.maxAttempts < 1) {
            throw new CacheValidationException("maxAttempts must be at least 1: " + b.maxAttempts);
        }
        if (b.retryBackoff == null || b.retryBackoff.isNegative()) {
            throw new CacheValidationException("retryBackoff must not be negative: " + b.retryBackoff);
        }
        this.host = b.host;
        this.port = b.port;
        this.password = b.password;
        this.database = b.database;
        this.connectTimeout = b.connectTimeout;
        this.maxTotal = b.maxTotal;
        this.maxIdle = b.maxIdle;
        this.minIdle = b.minIdle;
        this.maxAttempts = b.maxAttempts;
        this.retryBackoff = b.retryBackoff;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /** May be null. */
    public String getPassword() {
        return password;
    }

    public int getDatabase() {
        return database;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public int getMaxTotal() {
        return maxTotal;
    }

    public int getMaxIdle() {
        return maxIdle;
    }

    public int getMinIdle() {
        return minIdle;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public String address() {
        return host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        // password deliberately left out
        return "RedisSettings{address=" + address() + ", connectTimeout=" + connectTimeout + ", pool=" + maxTotal
            + "/" + maxIdle + "/" + minIdle + ", maxAttempts=" + maxAttempts + "}";
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = 6379;
        private String password;
        private int database = 0;
        private Duration connectTimeout = Duration.ofSeconds(2);
        private int maxTotal = 20;
        private int maxIdle = 10;
        private int minIdle = 2;
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(100);

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder password(String password) {
            this.password = password == null || password.isEmpty() ? null : password;
            return this;
        }

        public Builder database(int database) {
            this.database = database;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder pool(int maxTotal, int maxIdle, int minIdle) {
            this.maxTotal = maxTotal;
            this.maxIdle = maxIdle;
            this.minIdle = minIdle;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public RedisSettings build() {
            return new RedisSettings(this);
        }
    }
}
