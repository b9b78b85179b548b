package com.github.rudygunawan.memo.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the statistics and info snapshots.
 */
class CacheStatsTest {

    @Test
    void testEmptyStats() {
        CacheStats stats = new CacheStats(0, 0, 0, 0, 0, 0);

        assertEquals(0, stats.requestCount());
        assertEquals(1.0, stats.hitRate());
        assertEquals(0.0, stats.averageLoadPenalty());
    }

    @Test
    void testDerivedValues() {
        CacheStats stats = new CacheStats(6, 2, 1, 1, 500, 3);

        assertEquals(8, stats.requestCount());
        assertEquals(0.75, stats.hitRate(), 0.0001);
        assertEquals(2, stats.loadCount());
        assertEquals(250.0, stats.averageLoadPenalty(), 0.0001);
        assertTrue(stats.toString().contains("hitCount=6"));
    }

    @Test
    void testEquality() {
        assertEquals(new CacheStats(3, 1, 1, 1, 80, 0), new CacheStats(3, 1, 1, 1, 80, 0));
        assertNotEquals(new CacheStats(3, 1, 1, 1, 80, 0), new CacheStats(3, 1, 1, 1, 80, 1));
    }

    @Test
    void testInfoSnapshot() {
        CacheInfo withTtl = new CacheInfo(1, 2, 3, 4, Duration.ofSeconds(5), 0);
        CacheInfo withoutTtl = new CacheInfo(1, 2, 3, 4, null, 0);

        assertEquals(Optional.of(Duration.ofSeconds(5)), withTtl.ttl());
        assertEquals(Optional.empty(), withoutTtl.ttl());
        assertNotEquals(withTtl, withoutTtl);
        assertEquals(withoutTtl, new CacheInfo(1, 2, 3, 4, null, 0));
    }
}
