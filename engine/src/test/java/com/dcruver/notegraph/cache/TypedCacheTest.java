package com.dcruver.notegraph.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TypedCacheTest {

    private MutableClock clock;
    private TypedCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-15T10:00:00Z"));
        cache = new TypedCache(new IncrementalCache<>(new FileHasher(), Duration.ofMinutes(5), clock));
    }

    @Test
    void testStoresByTypeAndIdentifier() {
        cache.setCache("pagerank", "/notes", 42);
        cache.setCache("stats", "/notes", "other");

        Integer value = cache.getCache("pagerank", "/notes");
        assertEquals(42, value);
        assertEquals("other", cache.<String>getCache("stats", "/notes"));
        assertNull(cache.getCache("pagerank", "/elsewhere"));
    }

    @Test
    void testHashGatesValidity() {
        cache.setCache("pagerank", "/notes", "result", "abc");

        assertTrue(cache.isCacheValid("pagerank", "/notes", "abc"));
        assertFalse(cache.isCacheValid("pagerank", "/notes", "def"));
        assertFalse(cache.isCacheValid("pagerank", "/missing", "abc"));

        cache.setCache("pagerank", "/unhashed", "result");
        assertTrue(cache.isCacheValid("pagerank", "/unhashed", "anything"));
    }

    @Test
    void testExpiry() {
        cache.setCache("pagerank", "/notes", "result", "abc");

        clock.advance(Duration.ofMinutes(5));

        assertFalse(cache.isCacheValid("pagerank", "/notes", "abc"));
        assertNull(cache.getCache("pagerank", "/notes"));
    }

    @Test
    void testInvalidation() {
        cache.setCache("pagerank", "/a", 1);
        cache.setCache("pagerank", "/b", 2);
        cache.setCache("stats", "/a", 3);

        cache.invalidateCache("pagerank", "/a");
        assertNull(cache.getCache("pagerank", "/a"));

        assertEquals(1, cache.invalidateCacheByType("pagerank"));
        assertNull(cache.getCache("pagerank", "/b"));
        assertEquals(3, cache.<Integer>getCache("stats", "/a"));

        cache.clear();
        assertNull(cache.getCache("stats", "/a"));
    }

    @Test
    void testKeyFormat() {
        assertEquals("pagerank:/notes", TypedCache.createKey("pagerank", "/notes"));
    }
}
