package com.example.distcache.redis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

public final class RedisPools {

    private static final Logger log = LoggerFactory.getLogger(RedisPools.class);

    private RedisPools() {
    }

    /**
     * Builds a bounded pool. A borrow waits at most the connect timeout before failing, so an
     * exhausted pool surfaces as an error instead of blocking the caller indefinitely.
     */
    public static JedisPool create(RedisSettings settings) {
        JedisPoolConfig config = new JedisPoolConfig();
        config.setMaxTotal(settings.getMaxTotal());
        config.setMaxIdle(settings.getMaxIdle());
        config.setMinIdle(settings.getMinIdle());
        config.setTestOnBorrow(true);
        config.setBlockWhenExhausted(true);
        config.setMaxWait(settings.getConnectTimeout());

        int timeoutMillis = (int) settings.getConnectTimeout().toMillis();
        JedisPool pool = new JedisPool(config, settings.getHost(), settings.getPort(), timeoutMillis,
            settings.getPassword(), settings.getDatabase());
        log.info("Redis pool created for {}", settings);
        return pool;
    }
}
