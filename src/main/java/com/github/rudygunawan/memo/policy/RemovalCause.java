package com.github.rudygunawan.memo.policy;

/**
 * The reason why a memoized result was removed from the store.
 */
public enum RemovalCause {
    /**
     * The entry was removed by {@code invalidate} or {@code invalidateAsync}.
     */
    EXPLICIT,

    /**
     * The entry was overwritten by a newer result for the same arguments.
     */
    REPLACED,

    /**
     * The entry was the least recently used one when the store exceeded its maximum size.
     */
    SIZE,

    /**
     * The entry was found older than the time-to-live on access or during {@code cleanUp()}.
     */
    EXPIRED,

    /**
     * The entry was discarded by {@code clear()}.
     */
    CLEARED;

    /**
     * Returns {@code true} if the removal was caused by eviction (either SIZE or EXPIRED),
     * rather than manual removal or replacement.
     */
    public boolean wasEvicted() {
        return this == SIZE || this == EXPIRED;
    }
}
