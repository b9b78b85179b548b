package com.github.rudygunawan.memo.listener;

import com.github.rudygunawan.memo.key.CacheKey;
import com.github.rudygunawan.memo.policy.RemovalCause;

/**
 * A listener that receives notification when a memoized result is removed from the cache.
 *
 * <p>Implementations should be thread-safe and should not perform expensive operations
 * as they are called synchronously while the cache holds its lock. The listener must not
 * call back into the cache from another thread and wait for it.
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoCache cache = MemoCacheBuilder.newBuilder()
 *     .maximumSize(100)
 *     .removalListener((key, value, cause) -> log.info("Removed " + key + " because " + cause))
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface RemovalListener {

    /**
     * Notifies the listener that a removal occurred.
     *
     * @param key the key of the removed entry
     * @param value the value of the removed entry, may be {@code null}
     * @param cause the reason for the removal
     */
    void onRemoval(CacheKey key, Object value, RemovalCause cause);
}
