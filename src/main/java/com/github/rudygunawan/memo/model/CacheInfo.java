package com.github.rudygunawan.memo.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A point-in-time snapshot of a memo cache's counters and configuration.
 */
public final class CacheInfo {
    private final long hits;
    private final long misses;
    private final long size;
    private final long maxSize;
    private final Duration ttl;
    private final int inflightCount;

    public CacheInfo(long hits, long misses, long size, long maxSize, Duration ttl, int inflightCount) {
        this.hits = hits;
        this.misses = misses;
        this.size = size;
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.inflightCount = inflightCount;
    }

    public long hits() {
        return hits;
    }

    public long misses() {
        return misses;
    }

    public long size() {
        return size;
    }

    public long maxSize() {
        return maxSize;
    }

    /**
     * Returns the configured time-to-live, or empty if entries never expire.
     */
    public Optional<Duration> ttl() {
        return Optional.ofNullable(ttl);
    }

    /**
     * Returns the number of asynchronous computations in flight when the snapshot was taken.
     */
    public int inflightCount() {
        return inflightCount;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheInfo)) {
            return false;
        }
        CacheInfo other = (CacheInfo) obj;
        return hits == other.hits
                && misses == other.misses
                && size == other.size
                && maxSize == other.maxSize
                && Objects.equals(ttl, other.ttl)
                && inflightCount == other.inflightCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hits, misses, size, maxSize, ttl, inflightCount);
    }

    @Override
    public String toString() {
        return "CacheInfo{"
                + "hits=" + hits
                + ", misses=" + misses
                + ", size=" + size
                + ", maxSize=" + maxSize
                + ", ttl=" + ttl
                + ", inflight=" + inflightCount
                + '}';
    }
}
