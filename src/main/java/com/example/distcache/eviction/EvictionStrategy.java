package com.example.distcache.eviction;

import java.util.Optional;

/**
 * Order-tracking structure behind bounded eviction. Callers hold the affected key's stripe lock
 * for {@link #onWrite} and {@link #onRemove}, so a key is tracked exactly while its entry is
 * stored. Implementations guard their own structure and never call back into the store.
 */
public interface EvictionStrategy {

    /** A live entry was read. Unknown keys are ignored. */
    void onAccess(String key);

    /** An entry was inserted or overwritten. */
    void onWrite(String key);

    /** An entry left the store for any reason. Unknown keys are ignored. */
    void onRemove(String key);

    /** Next key to evict, without removing it. Empty when nothing is tracked. */
    Optional<String> selectVictim();

    int size();

    void clear();
}
