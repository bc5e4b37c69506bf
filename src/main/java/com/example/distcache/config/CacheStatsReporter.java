package com.example.distcache.config;

import com.example.distcache.core.Cache;
import com.example.distcache.core.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Logs the cache's stats snapshot at a fixed rate.
 */
@Component
public class CacheStatsReporter {

    private static final Logger log = LoggerFactory.getLogger(CacheStatsReporter.class);

    private final Cache cache;

    public CacheStatsReporter(Cache cache) {
        this.cache = cache;
    }

    @Scheduled(fixedDelayString = "${cache.stats-log-interval-ms:300000}",
               initialDelayString = "${cache.stats-log-interval-ms:300000}")
    public void report() {
        try {
            CacheStats stats = cache.cacheStats();
            log.info("Cache stats: {}", stats);
        } catch (RuntimeException e) {
            log.warn("Could not read cache stats: {}", e.getMessage());
        }
    }
}
