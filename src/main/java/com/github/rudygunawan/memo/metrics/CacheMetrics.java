package com.github.rudygunawan.memo.metrics;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by MicrometerCacheMetrics to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries in the cache.
     */
    long size();

    /**
     * Returns the configured maximum number of entries.
     */
    long maximumSize();

    /**
     * Returns the total number of cache hits.
     */
    long hitCount();

    /**
     * Returns the total number of cache misses.
     */
    long missCount();

    /**
     * Returns the total number of evictions, by size or by expiry.
     */
    long evictionCount();

    /**
     * Returns the total number of successful computations.
     */
    long loadSuccessCount();

    /**
     * Returns the total number of failed computations.
     */
    long loadFailureCount();

    /**
     * Returns the total time spent computing in nanoseconds.
     */
    long totalLoadTimeNanos();

    /**
     * Returns the number of asynchronous computations currently in flight.
     */
    int inflightCount();

    /**
     * Returns the ratio of hits to requests, or {@code 0.0} before the first request.
     */
    default double hitRatio() {
        long hits = hitCount();
        long total = hits + missCount();
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
