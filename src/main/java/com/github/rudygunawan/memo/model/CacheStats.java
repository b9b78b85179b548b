package com.github.rudygunawan.memo.model;

import java.util.Objects;

/**
 * Statistics about the performance of a memo cache. Instances of this class are immutable.
 *
 * <p>Statistics are incremented according to the following rules:
 *
 * <ul>
 *   <li>When a call finds a fresh cached result, {@code hitCount} is incremented.
 *   <li>When a call has to compute its result, {@code missCount} is incremented once. An
 *       asynchronous call that joins a computation already in flight counts as neither.
 *   <li>When the computation returns, {@code loadSuccessCount} is incremented; when it throws or
 *       completes exceptionally, {@code loadFailureCount} is incremented instead.
 *   <li>When an entry is removed because the cache is full or its time-to-live has passed,
 *       {@code evictionCount} is incremented.
 * </ul>
 *
 * <p>All counters are reset to zero by {@code clear()}.
 */
public class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long loadSuccessCount;
    private final long loadFailureCount;
    private final long totalLoadTime;
    private final long evictionCount;

    /**
     * Constructs a new {@code CacheStats} instance.
     */
    public CacheStats(
            long hitCount,
            long missCount,
            long loadSuccessCount,
            long loadFailureCount,
            long totalLoadTime,
            long evictionCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.loadSuccessCount = loadSuccessCount;
        this.loadFailureCount = loadFailureCount;
        this.totalLoadTime = totalLoadTime;
        this.evictionCount = evictionCount;
    }

    /**
     * Returns {@code hitCount + missCount}.
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    public long hitCount() {
        return hitCount;
    }

    /**
     * Returns the ratio of requests which were hits, or {@code 1.0} when there were no requests.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
    }

    public long missCount() {
        return missCount;
    }

    /**
     * Returns the number of computations that finished, successfully or not.
     */
    public long loadCount() {
        return loadSuccessCount + loadFailureCount;
    }

    public long loadSuccessCount() {
        return loadSuccessCount;
    }

    public long loadFailureCount() {
        return loadFailureCount;
    }

    /**
     * Returns the total number of nanoseconds spent in computations.
     */
    public long totalLoadTime() {
        return totalLoadTime;
    }

    /**
     * Returns {@code totalLoadTime / loadCount}, or {@code 0.0} when nothing was computed.
     */
    public double averageLoadPenalty() {
        long totalLoadCount = loadCount();
        return (totalLoadCount == 0) ? 0.0 : (double) totalLoadTime / totalLoadCount;
    }

    public long evictionCount() {
        return evictionCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, missCount, loadSuccessCount, loadFailureCount, totalLoadTime, evictionCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return hitCount == other.hitCount
                && missCount == other.missCount
                && loadSuccessCount == other.loadSuccessCount
                && loadFailureCount == other.loadFailureCount
                && totalLoadTime == other.totalLoadTime
                && evictionCount == other.evictionCount;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", loadSuccessCount=" + loadSuccessCount
                + ", loadFailureCount=" + loadFailureCount
                + ", totalLoadTime=" + totalLoadTime
                + ", evictionCount=" + evictionCount
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}
