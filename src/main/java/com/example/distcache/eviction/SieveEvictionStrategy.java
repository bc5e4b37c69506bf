package com.example.distcache.eviction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SIEVE eviction ("SIEVE is Simpler than LRU", NSDI '24).
 *
 * <p>Keys are queued newest-first and never move. A read only marks its key as visited. To pick a
 * victim the hand walks from the oldest key towards the newest, clearing marks as it passes, and
 * stops at the first unmarked key; past the newest key it wraps to the oldest again. The hand keeps
 * its position between calls.
 */
public class SieveEvictionStrategy implements EvictionStrategy {

    private static final class Slot {
        final String key;
        boolean visited;
        Slot newer;
        Slot older;

        Slot(String key) {
            this.key = key;
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Slot> index = new HashMap<>();
    private Slot newest;
    private Slot oldest;
    private Slot hand;

    @Override
    public void onAccess(String key) {
        lock.lock();
        try {
            mark(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onWrite(String key) {
        lock.lock();
        try {
            if (mark(key)) {
                return;
            }
            // unvisited on arrival, so keys written once and never read leave first
            Slot slot = new Slot(key);
            index.put(key, slot);
            slot.older = newest;
            if (newest != null) {
                newest.newer = slot;
            } else {
                oldest = slot;
            }
            newest = slot;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onRemove(String key) {
        lock.lock();
        try {
            Slot slot = index.remove(key);
            if (slot != null) {
                unlink(slot);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> selectVictim() {
        lock.lock();
        try {
            if (index.isEmpty()) {
                return Optional.empty();
            }
            Slot current = hand != null ? hand : oldest;
            while (current.visited) {
                current.visited = false;
                current = current.newer != null ? current.newer : oldest;
            }
            hand = current;
            return Optional.of(current.key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            index.clear();
            newest = null;
            oldest = null;
            hand = null;
        } finally {
            lock.unlock();
        }
    }

    private boolean mark(String key) {
        Slot slot = index.get(key);
        if (slot == null) {
            return false;
        }
        slot.visited = true;
        return true;
    }

    private void unlink(Slot slot) {
        if (hand == slot) {
            hand = slot.newer;
        }
        if (slot.newer != null) {
            slot.newer.older = slot.older;
        } else {
            newest = slot.older;
        }
        if (slot.older != null) {
            slot.older.newer = slot.newer;
        } else {
            oldest = slot.newer;
        }
        slot.newer = null;
        slot.older = null;
    }
}
