package com.example.distcache.eviction;

import java.util.function.Supplier;

public enum EvictionPolicy {
    LRU(LruEvictionStrategy::new),
    SIEVE(SieveEvictionStrategy::new);

    private final Supplier<EvictionStrategy> factory;

    EvictionPolicy(Supplier<EvictionStrategy> factory) {
        this.factory = factory;
    }

    public EvictionStrategy newStrategy() {
        return factory.get();
    }
}
