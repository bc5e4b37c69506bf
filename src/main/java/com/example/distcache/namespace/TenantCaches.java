package com.example.distcache.namespace;

import com.example.distcache.core.Cache;
import com.example.distcache.core.CacheValidationException;

/**
 * Per-tenant views of a shared cache. A tenant's keys are stored as
 * {@code tenant:<tenantId>:<key>}, so tenants never see each other's entries and flushing a
 * tenant view leaves every other tenant intact.
 */
public final class TenantCaches {

    public static final String TENANT_NAMESPACE = "tenant";

    private TenantCaches() {
    }

    public static Cache forTenant(Cache cache, String tenantId) {
        if (cache == null) {
            throw new IllegalArgumentException("cache must not be null");
        }
        return cache.withNamespace(tenantNamespace(tenantId));
    }

    /** Returns {@code cache} unchanged when {@code tenantId} is null. */
    public static Cache forOptionalTenant(Cache cache, String tenantId) {
        return tenantId == null ? cache : forTenant(cache, tenantId);
    }

    /** Full storage key of {@code key} for {@code tenantId}. */
    public static String tenantKey(String tenantId, String key) {
        return tenantNamespace(tenantId) + ":" + key;
    }

    private static String tenantNamespace(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new CacheValidationException("tenant id must not be blank");
        }
        return TENANT_NAMESPACE + ":" + tenantId;
    }
}
