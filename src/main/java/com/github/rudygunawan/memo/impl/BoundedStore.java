package com.github.rudygunawan.memo.impl;

import com.github.rudygunawan.memo.model.CacheEntry;
import com.github.rudygunawan.memo.model.Lookup;
import com.github.rudygunawan.memo.policy.RemovalCause;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Size-bounded, recency-ordered map of cache entries with lazy time-to-live expiry.
 *
 * <p>Entries are kept in access order: the least recently used key is first and the most recently
 * used key is last. A fresh {@link #get} and every {@link #put} move the key to the end. When a put
 * grows the store past its maximum size, exactly one entry, the first, is evicted. Expired entries
 * are removed by the lookup that observes them or by {@link #cleanUp}; nothing runs in the background.
 *
 * <p><b>Not thread-safe.</b> The owning cache guards every call with its lock.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class BoundedStore<K, V> {

    /**
     * Receives every entry the store drops, together with the reason.
     */
    @FunctionalInterface
    public interface RemovalSink<K, V> {
        void onRemoval(K key, V value, RemovalCause cause);
    }

    private final LinkedHashMap<K, CacheEntry<V>> entries;
    private final long maximumSize;
    private final long ttlNanos;
    private final RemovalSink<K, V> sink;

    /**
     * Creates an empty store.
     *
     * @param maximumSize the maximum number of entries, must be positive
     * @param ttlNanos the time-to-live in nanoseconds, or 0 for no expiration
     * @param sink receives removed entries
     */
    public BoundedStore(long maximumSize, long ttlNanos, RemovalSink<K, V> sink) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximum size must be positive");
        }
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
        this.maximumSize = maximumSize;
        this.ttlNanos = Math.max(0, ttlNanos);
        this.sink = sink;
    }

    /**
     * Looks up {@code key} at time {@code now}. A fresh hit becomes the most recently used entry; an
     * expired entry is removed and reported as found but not fresh.
     */
    public Lookup<V> get(K key, long now) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Lookup.absent();
        }
        if (entry.isExpired(now, ttlNanos)) {
            entries.remove(key);
            sink.onRemoval(key, entry.getValue(), RemovalCause.EXPIRED);
            return Lookup.expired();
        }
        return Lookup.hit(entry.getValue());
    }

    /**
     * Stores {@code value} under {@code key} as the most recently used entry, stamped with
     * {@code now}, evicting the least recently used entry if the store overflows.
     */
    public void put(K key, V value, long now) {
        CacheEntry<V> previous = entries.put(key, new CacheEntry<>(value, now));
        if (previous != null) {
            sink.onRemoval(key, previous.getValue(), RemovalCause.REPLACED);
        }
        if (entries.size() > maximumSize) {
            evictEldest();
        }
    }

    /**
     * Removes {@code key} if present.
     *
     * @return true if an entry was removed
     */
    public boolean remove(K key) {
        CacheEntry<V> removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        sink.onRemoval(key, removed.getValue(), RemovalCause.EXPLICIT);
        return true;
    }

    /**
     * Removes every entry.
     */
    public void clear() {
        Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<K, CacheEntry<V>> entry = it.next();
            it.remove();
            sink.onRemoval(entry.getKey(), entry.getValue().getValue(), RemovalCause.CLEARED);
        }
    }

    /**
     * Removes every entry that has expired at {@code now}.
     *
     * @return the number of entries removed
     */
    public int cleanUp(long now) {
        if (ttlNanos == 0) {
            return 0;
        }
        int removed = 0;
        Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<K, CacheEntry<V>> entry = it.next();
            if (entry.getValue().isExpired(now, ttlNanos)) {
                it.remove();
                removed++;
                sink.onRemoval(entry.getKey(), entry.getValue().getValue(), RemovalCause.EXPIRED);
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns true if {@code key} has an entry, fresh or not, without touching its recency.
     */
    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    /**
     * Returns the keys from least to most recently used.
     */
    public List<K> keysInRecencyOrder() {
        return new ArrayList<>(entries.keySet());
    }

    private void evictEldest() {
        Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
        Map.Entry<K, CacheEntry<V>> eldest = it.next();
        it.remove();
        sink.onRemoval(eldest.getKey(), eldest.getValue().getValue(), RemovalCause.SIZE);
    }
}
