package com.example.distcache.memory;

import com.example.distcache.core.CacheEntry;

/**
 * Outcome of a read-modify-write step run by {@link EntryStore#update}.
 */
public final class Mutation<T> {

    enum Kind { KEEP, WRITE, RETIME, REMOVE }

    final Kind kind;
    final CacheEntry replacement;
    final T result;

    private Mutation(Kind kind, CacheEntry replacement, T result) {
        this.kind = kind;
        this.replacement = replacement;
        this.result = result;
    }

    /** Leave the entry as it is. */
    public static <T> Mutation<T> keep(T result) {
        return new Mutation<>(Kind.KEEP, null, result);
    }

    /** Store a new value; the key becomes most recently used. */
    public static <T> Mutation<T> write(CacheEntry replacement, T result) {
        return new Mutation<>(Kind.WRITE, replacement, result);
    }

    /** Swap in an entry that differs only in expiry; recency is left alone. */
    public static <T> Mutation<T> retime(CacheEntry replacement, T result) {
        return new Mutation<>(Kind.RETIME, replacement, result);
    }

    public static <T> Mutation<T> remove(T result) {
        return new Mutation<>(Kind.REMOVE, null, result);
    }
}
