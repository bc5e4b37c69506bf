package com.example.distcache.memory;

import com.example.distcache.core.CacheEntry;

@FunctionalInterface
public interface EntryUpdate<T> {

    /**
     * @param live the current live entry, or null when the key is absent or expired
     * @param nowMillis the clock reading taken under the key's lock
     */
    Mutation<T> apply(CacheEntry live, long nowMillis);
}
