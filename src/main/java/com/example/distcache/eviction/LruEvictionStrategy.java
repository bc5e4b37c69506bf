package com.example.distcache.eviction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Least-recently-used order kept as a doubly linked list indexed by key. Head is the most
 * recently used key, tail the next victim. Touch and victim selection are O(1).
 */
public class LruEvictionStrategy implements EvictionStrategy {

    private static class Node {
        final String key;
        Node prev;
        Node next;

        Node(String key) {
            this.key = key;
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Node> index = new HashMap<>();
    private Node head;
    private Node tail;

    @Override
    public void onAccess(String key) {
        lock.lock();
        try {
            Node node = index.get(key);
            if (node != null) {
                promote(node);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onWrite(String key) {
        lock.lock();
        try {
            Node node = index.get(key);
            if (node != null) {
                promote(node);
                return;
            }
            node = new Node(key);
            index.put(key, node);
            linkFirst(node);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onRemove(String key) {
        lock.lock();
        try {
            Node node = index.remove(key);
            if (node != null) {
                unlink(node);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> selectVictim() {
        lock.lock();
        try {
            return tail == null ? Optional.empty() : Optional.of(tail.key);
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
            head = tail = null;
        } finally {
            lock.unlock();
        }
    }

    private void promote(Node node) {
        if (node == head) {
            return;
        }
        unlink(node);
        linkFirst(node);
    }

    private void linkFirst(Node node) {
        node.prev = null;
        node.next = head;
        if (head == null) {
            tail = node;
        } else {
            head.prev = node;
        }
        head = node;
    }

    private void unlink(Node node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }
        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.prev = null;
        node.next = null;
    }
}
