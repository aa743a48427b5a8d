package com.shellbridge.core.shell;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.function.Function;

/**
 * Insertion-ordered memo table keyed by value. Once the entry count exceeds
 * {@code capacity}, the oldest fifth of the entries is evicted in one pass.
 * <p>
 * Values are pure functions of their keys, so a lookup racing an insertion can
 * at worst compute the same value twice; only the map itself needs the lock.
 */
final class BoundedFifoCache<K, V> {

    private final int capacity;
    private final int evictionBatch;
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>();

    BoundedFifoCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        this.capacity = capacity;
        this.evictionBatch = Math.max(1, capacity / 5);
    }

    V computeIfAbsent(K key, Function<K, V> loader) {
        synchronized (entries) {
            V cached = entries.get(key);
            if (cached != null) {
                return cached;
            }
        }
        V value = loader.apply(key);
        synchronized (entries) {
            V raced = entries.putIfAbsent(key, value);
            if (raced != null) {
                return raced;
            }
            if (entries.size() > capacity) {
                evictOldest();
            }
            return value;
        }
    }

    private void evictOldest() {
        Iterator<K> it = entries.keySet().iterator();
        for (int i = 0; i < evictionBatch && it.hasNext(); i++) {
            it.next();
            it.remove();
        }
    }

    boolean contains(K key) {
        synchronized (entries) {
            return entries.containsKey(key);
        }
    }

    int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    int capacity() {
        return capacity;
    }

    void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }
}
