package com.shellbridge.core.shell;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedFifoCacheTest {

    @Test
    @DisplayName("loader runs once per key")
    void loaderRunsOnce() {
        var cache = new BoundedFifoCache<String, Integer>(10);
        var calls = new AtomicInteger();

        cache.computeIfAbsent("a", k -> calls.incrementAndGet());
        cache.computeIfAbsent("a", k -> calls.incrementAndGet());

        assertEquals(1, calls.get());
        assertTrue(cache.contains("a"));
    }

    @Test
    @DisplayName("overflow evicts the oldest entries first")
    void evictsOldestFirst() {
        var cache = new BoundedFifoCache<Integer, Integer>(5);
        for (int i = 0; i < 6; i++) {
            cache.computeIfAbsent(i, k -> k);
        }

        assertEquals(5, cache.size());
        assertFalse(cache.contains(0));
        assertTrue(cache.contains(5));
    }

    @Test
    @DisplayName("eviction batch is a fifth of capacity")
    void evictionBatch() {
        var cache = new BoundedFifoCache<Integer, Integer>(20);
        for (int i = 0; i < 21; i++) {
            cache.computeIfAbsent(i, k -> k);
        }

        assertEquals(17, cache.size());
        for (int i = 0; i < 4; i++) {
            assertFalse(cache.contains(i));
        }
        assertTrue(cache.contains(4));
    }

    @Test
    @DisplayName("capacity below one is rejected")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedFifoCache<String, String>(0));
    }
}
