package com.example.distcache.namespace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.distcache.core.Cache;
import com.example.distcache.core.CacheSettings;
import com.example.distcache.core.CacheValidationException;
import com.example.distcache.memory.InMemoryCache;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TenantCachesTest {

    private final InMemoryCache shared = new InMemoryCache(CacheSettings.defaults().withSweepInterval(Duration.ZERO));

    @AfterEach
    void tearDown() {
        shared.close();
    }

    @Test
    void tenantsAreIsolated() {
        Cache acme = TenantCaches.forTenant(shared, "acme");
        Cache globex = TenantCaches.forTenant(shared, "globex");

        acme.set("config", "a");
        globex.set("config", "g");

        assertThat(acme.get("config")).contains("a");
        assertThat(globex.get("config")).contains("g");
        assertThat(shared.get(TenantCaches.tenantKey("acme", "config"))).contains("a");
    }

    @Test
    void flushingOneTenantKeepsOthers() {
        Cache acme = TenantCaches.forTenant(shared, "acme");
        Cache globex = TenantCaches.forTenant(shared, "globex");
        acme.set("a", 1);
        acme.set("b", 2);
        globex.set("a", 3);

        assertThat(acme.flushAll()).isEqualTo(2);
        assertThat(globex.exists("a")).isTrue();
    }

    @Test
    void tenantKeyFormat() {
        assertThat(TenantCaches.tenantKey("acme", "user:1")).isEqualTo("tenant:acme:user:1");
    }

    @Test
    void missingTenantFallsBackToSharedCache() {
        assertThat(TenantCaches.forOptionalTenant(shared, null)).isSameAs(shared);
        assertThat(TenantCaches.forOptionalTenant(shared, "acme")).isInstanceOf(NamespacedCache.class);
    }

    @Test
    void blankTenantIsRejected() {
        assertThatThrownBy(() -> TenantCaches.forTenant(shared, " ")).isInstanceOf(CacheValidationException.class);
        assertThatThrownBy(() -> TenantCaches.forTenant(shared, null)).isInstanceOf(CacheValidationException.class);
    }
}
