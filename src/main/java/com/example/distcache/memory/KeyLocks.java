package com.example.distcache.memory;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped exclusive sections. Two keys hashing to the same stripe share a lock; a key always maps
 * to the same stripe. Sections are short and never span I/O.
 */
public class KeyLocks {

    private final ReentrantLock[] stripes;
    private final int mask;

    public KeyLocks(int concurrency) {
        int size = 1;
        while (size < concurrency) {
            size <<= 1;
        }
        this.stripes = new ReentrantLock[size];
        for (int i = 0; i < size; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.mask = size - 1;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public int stripeCount() {
        return stripes.length;
    }

    ReentrantLock lockFor(String key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return stripes[h & mask];
    }
}
