package com.github.rudygunawan.memo.model;

/**
 * A stored result together with the ticker reading taken when it was written.
 *
 * <p>Entries are immutable; refreshing a key replaces its entry.
 *
 * @param <V> the type of the cached value
 */
public final class CacheEntry<V> {

    private final V value;
    private final long writeTime;

    /**
     * Creates a new cache entry.
     *
     * @param value the value to cache, may be {@code null}
     * @param writeTime the ticker reading, in nanoseconds, at which the value was stored
     */
    public CacheEntry(V value, long writeTime) {
        this.value = value;
        this.writeTime = writeTime;
    }

    public V getValue() {
        return value;
    }

    /**
     * Returns the time (in nanoseconds) when this entry was written.
     */
    public long getWriteTime() {
        return writeTime;
    }

    /**
     * Returns the age of this entry at {@code now}, in nanoseconds.
     */
    public long getAgeNanos(long now) {
        return now - writeTime;
    }

    /**
     * Returns true if this entry is at least {@code ttlNanos} old at {@code now}. A non-positive
     * {@code ttlNanos} means the entry never expires.
     */
    public boolean isExpired(long now, long ttlNanos) {
        return ttlNanos > 0 && getAgeNanos(now) >= ttlNanos;
    }

    @Override
    public String toString() {
        return "CacheEntry{value=" + value + ", writeTime=" + writeTime + '}';
    }
}
