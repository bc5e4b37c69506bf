package com.example.distcache.config;

import com.example.distcache.core.Cache;
import com.example.distcache.core.CacheSettings;
import com.example.distcache.memory.InMemoryCache;
import com.example.distcache.redis.RedisCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CacheConfiguration.class);

    @Bean(destroyMethod = "close")
    public Cache cache(CacheProperties properties, ObjectMapper objectMapper) {
        CacheSettings settings = properties.toSettings();
        log.info("Using {} cache backend", properties.getBackend());
        switch (properties.getBackend()) {
            case REDIS:
                return RedisCache.connect(properties.getRedis().toSettings(), settings, objectMapper);
            case MEMORY:
                return new InMemoryCache(settings);
            default:
                throw new IllegalArgumentException("Unknown cache backend: " + properties.getBackend());
        }
    }
}
