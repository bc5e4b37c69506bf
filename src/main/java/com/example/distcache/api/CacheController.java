package com.example.distcache.api;

import com.example.distcache.core.Cache;
import com.example.distcache.core.CacheStats;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Thin admin surface over the configured {@link Cache}.
 */
@RestController
@RequestMapping("/cache")
public class CacheController {

    private final Cache cache;

    public CacheController(Cache cache) {
        this.cache = cache;
    }

    @GetMapping("/entries/{key}")
    public ResponseEntity<Object> get(@PathVariable String key) {
        return cache.get(key)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/entries/{key}")
    public ResponseEntity<Void> set(@PathVariable String key,
                                    @RequestBody Object value,
                                    @RequestParam(required = false) Long ttlSeconds) {
        cache.set(key, value, ttlSeconds == null ? null : Duration.ofSeconds(ttlSeconds));
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/entries/{key}")
    public ResponseEntity<Void> delete(@PathVariable String key) {
        return cache.delete(key)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/entries/{key}/ttl")
    public ResponseEntity<Map<String, Object>> ttl(@PathVariable String key) {
        if (!cache.exists(key)) {
            return ResponseEntity.notFound().build();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("key", key);
        cache.ttl(key).ifPresent(ttl -> body.put("ttlMillis", ttl.toMillis()));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/entries/{key}/increment")
    public Map<String, Object> increment(@PathVariable String key,
                                         @RequestParam(defaultValue = "1") long delta) {
        return Map.of("key", key, "value", cache.increment(key, delta));
    }

    @GetMapping("/keys")
    public Set<String> keys(@RequestParam(defaultValue = "*") String pattern) {
        return cache.keysMatching(pattern);
    }

    @DeleteMapping("/keys")
    public Map<String, Object> deleteKeys(@RequestParam String pattern) {
        return Map.of("pattern", pattern, "deleted", cache.deleteMatching(pattern));
    }

    @DeleteMapping("/namespaces/{namespace}")
    public Map<String, Object> clearNamespace(@PathVariable String namespace) {
        return Map.of("namespace", namespace, "deleted", cache.clearNamespace(namespace));
    }

    @GetMapping("/stats")
    public CacheStats stats() {
        return cache.cacheStats();
    }

    @PostMapping("/stats/reset")
    public ResponseEntity<Void> resetStats() {
        cache.clearStats();
        return ResponseEntity.noContent().build();
    }
}
