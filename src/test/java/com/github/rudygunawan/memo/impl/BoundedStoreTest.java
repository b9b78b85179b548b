package com.github.rudygunawan.memo.impl;

import com.github.rudygunawan.memo.model.Lookup;
import com.github.rudygunawan.memo.policy.RemovalCause;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LRU/TTL store underneath the memo cache.
 */
class BoundedStoreTest {

    private final List<String> removals = new ArrayList<>();

    private BoundedStore<String, Integer> newStore(long maximumSize, long ttlNanos) {
        return new BoundedStore<>(maximumSize, ttlNanos, (key, value, cause) -> removals.add(key + ":" + cause));
    }

    @Test
    void testGetAbsent() {
        BoundedStore<String, Integer> store = newStore(3, 0);

        Lookup<Integer> lookup = store.get("missing", 0);
        assertFalse(lookup.isFound());
        assertFalse(lookup.isHit());
    }

    @Test
    void testPutThenGet() {
        BoundedStore<String, Integer> store = newStore(3, 0);

        store.put("a", 1, 0);
        Lookup<Integer> lookup = store.get("a", 100);
        assertTrue(lookup.isHit());
        assertEquals(1, lookup.getValue());
        assertEquals(1, store.size());
    }

    @Test
    void testNullValueIsAHit() {
        BoundedStore<String, Integer> store = newStore(3, 0);

        store.put("a", null, 0);
        Lookup<Integer> lookup = store.get("a", 0);
        assertTrue(lookup.isHit());
        assertNull(lookup.getValue());
    }

    @Test
    void testEvictsLeastRecentlyUsed() {
        BoundedStore<String, Integer> store = newStore(3, 0);

        store.put("a", 1, 0);
        store.put("b", 2, 0);
        store.put("c", 3, 0);
        store.put("d", 4, 0);

        assertEquals(3, store.size());
        assertFalse(store.containsKey("a"));
        assertEquals(List.of("b", "c", "d"), store.keysInRecencyOrder());
        assertEquals(List.of("a:SIZE"), removals);
    }

    @Test
    void testHitPromotesKey() {
        BoundedStore<String, Integer> store = newStore(3, 0);

        store.put("a", 1, 0);
        store.put("b", 2, 0);
        store.put("c", 3, 0);
        store.get("a", 0);
        store.put("d", 4, 0);

        assertTrue(store.containsKey("a"));
        assertFalse(store.containsKey("b"));
        assertEquals(List.of("c", "a", "d"), store.keysInRecencyOrder());
    }

    @Test
    void testOverwritePromotesAndReplaces() {
        BoundedStore<String, Integer> store = newStore(2, 0);

        store.put("a", 1, 0);
        store.put("b", 2, 0);
        store.put("a", 10, 5);
        store.put("c", 3, 5);

        assertEquals(List.of("a", "c"), store.keysInRecencyOrder());
        assertEquals(10, store.get("a", 5).getValue());
        assertEquals(List.of("a:REPLACED", "b:SIZE"), removals);
    }

    @Test
    void testExpiresAtTtlBoundary() {
        BoundedStore<String, Integer> store = newStore(3, 100);

        store.put("a", 1, 1_000);
        assertTrue(store.get("a", 1_099).isHit());

        Lookup<Integer> expired = store.get("a", 1_100);
        assertTrue(expired.isFound());
        assertFalse(expired.isFresh());
        assertFalse(store.containsKey("a"));
        assertEquals(List.of("a:EXPIRED"), removals);
    }

    @Test
    void testRewriteRefreshesTimestamp() {
        BoundedStore<String, Integer> store = newStore(3, 100);

        store.put("a", 1, 0);
        store.put("a", 2, 80);
        assertTrue(store.get("a", 150).isHit());
    }

    @Test
    void testNoTtlNeverExpires() {
        BoundedStore<String, Integer> store = newStore(3, 0);

        store.put("a", 1, 0);
        assertTrue(store.get("a", Long.MAX_VALUE).isHit());
    }

    @Test
    void testRemove() {
        BoundedStore<String, Integer> store = newStore(3, 0);

        store.put("a", 1, 0);
        assertTrue(store.remove("a"));
        assertFalse(store.remove("a"));
        assertEquals(0, store.size());
        assertEquals(List.of("a:EXPLICIT"), removals);
    }

    @Test
    void testClear() {
        BoundedStore<String, Integer> store = newStore(3, 0);

        store.put("a", 1, 0);
        store.put("b", 2, 0);
        store.clear();

        assertEquals(0, store.size());
        assertEquals(List.of("a:" + RemovalCause.CLEARED, "b:" + RemovalCause.CLEARED), removals);
    }

    @Test
    void testCleanUpSweepsExpired() {
        BoundedStore<String, Integer> store = newStore(5, 100);

        store.put("old", 1, 0);
        store.put("new", 2, 50);

        assertEquals(1, store.cleanUp(120));
        assertEquals(List.of("new"), store.keysInRecencyOrder());
    }

    @Test
    void testRejectsNonPositiveMaximum() {
        assertThrows(IllegalArgumentException.class, () -> newStore(0, 0));
    }
}
