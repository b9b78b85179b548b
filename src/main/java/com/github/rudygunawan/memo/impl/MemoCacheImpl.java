package com.github.rudygunawan.memo.impl;

import com.github.rudygunawan.memo.api.AsyncCachedFunction;
import com.github.rudygunawan.memo.api.CachedFunction;
import com.github.rudygunawan.memo.api.MemoCache;
import com.github.rudygunawan.memo.builder.MemoCacheBuilder;
import com.github.rudygunawan.memo.key.Arguments;
import com.github.rudygunawan.memo.key.CacheKey;
import com.github.rudygunawan.memo.key.KeyNormalizer;
import com.github.rudygunawan.memo.listener.RemovalListener;
import com.github.rudygunawan.memo.metrics.CacheMetrics;
import com.github.rudygunawan.memo.model.CacheInfo;
import com.github.rudygunawan.memo.model.CacheStats;
import com.github.rudygunawan.memo.model.Lookup;
import com.github.rudygunawan.memo.policy.RemovalCause;
import com.github.rudygunawan.memo.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Memo cache engine: one bounded LRU store with lazy TTL expiry, a blocking call path and a
 * single-flight asynchronous call path.
 *
 * <p>A single {@link ReentrantLock} guards the store, the registry of in-flight asynchronous
 * computations and the statistics counters, so synchronous and asynchronous callers can be mixed
 * freely on one instance. The lock is only held for lookups and writes; user computations, and the
 * completion of the futures handed to callers, always happen after it is released.
 *
 * <p>Logging: This class uses java.util.logging. Logger name: "com.github.rudygunawan.memo.MemoCache"
 * <ul>
 *   <li>WARNING: a removal listener threw (the cache operation still completes)</li>
 *   <li>FINE: evictions, expirations, cancelled flights, clears</li>
 *   <li>FINER: hit, miss and join decisions</li>
 * </ul>
 */
public class MemoCacheImpl implements MemoCache, CacheMetrics {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.memo.MemoCache");
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final ReentrantLock lock = new ReentrantLock();
    private final BoundedStore<CacheKey, Object> store;
    private final Map<CacheKey, Flight> inflight = new HashMap<>();
    private final Ticker ticker;
    private final long maximumSize;
    private final Duration ttl;
    private final RemovalListener removalListener;

    // Statistics, only incremented while holding the lock
    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong loadSuccessCount = new AtomicLong(0);
    private final AtomicLong loadFailureCount = new AtomicLong(0);
    private final AtomicLong totalLoadTime = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);

    public MemoCacheImpl(MemoCacheBuilder builder) {
        this.ticker = builder.getTicker();
        this.maximumSize = builder.getMaximumSize();
        this.ttl = builder.getExpireAfterWrite();
        this.removalListener = builder.getRemovalListener();
        long ttlNanos = ttl == null ? 0 : saturatedNanos(ttl);
        this.store = new BoundedStore<>(maximumSize, ttlNanos, this::onRemoval);
    }

    // Durations beyond ~292 years clamp to Long.MAX_VALUE, like TimeUnit.toNanos
    private static long saturatedNanos(Duration duration) {
        return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }

    // Sync path

    @Override
    @SuppressWarnings("unchecked")
    public <V> V call(CachedFunction<? extends V> function, Arguments args) throws Exception {
        Objects.requireNonNull(function, "function cannot be null");
        CacheKey key = KeyNormalizer.normalize(args);

        lock.lock();
        try {
            Lookup<Object> lookup = store.get(key, ticker.read());
            if (lookup.isHit()) {
                hitCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Hit: key=" + key);
                }
                return (V) lookup.getValue();
            }
            missCount.incrementAndGet();
        } finally {
            lock.unlock();
        }

        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Miss, computing: key=" + key);
        }
        long startTime = ticker.read();
        V value;
        try {
            value = function.apply(args);
        } catch (Throwable t) {
            lock.lock();
            try {
                loadFailureCount.incrementAndGet();
                totalLoadTime.addAndGet(ticker.read() - startTime);
            } finally {
                lock.unlock();
            }
            throw t;
        }

        lock.lock();
        try {
            long now = ticker.read();
            store.put(key, value, now);
            loadSuccessCount.incrementAndGet();
            totalLoadTime.addAndGet(now - startTime);
        } finally {
            lock.unlock();
        }
        return value;
    }

    // Async path

    @Override
    @SuppressWarnings("unchecked")
    public <V> CompletableFuture<V> callAsync(AsyncCachedFunction<V> function, Arguments args) {
        Objects.requireNonNull(function, "function cannot be null");
        CacheKey key = KeyNormalizer.normalize(args);

        Flight flight;
        lock.lock();
        try {
            Lookup<Object> lookup = store.get(key, ticker.read());
            if (lookup.isHit()) {
                hitCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Hit: key=" + key);
                }
                return CompletableFuture.completedFuture((V) lookup.getValue());
            }
            Flight running = inflight.get(key);
            if (running != null) {
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Joining flight in progress: key=" + key);
                }
                return running.join();
            }
            missCount.incrementAndGet();
            flight = new Flight(key, ticker.read());
            inflight.put(key, flight);
        } finally {
            lock.unlock();
        }

        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Miss, starting flight: key=" + key);
        }
        CompletableFuture<V> result = flight.join();
        CompletionStage<V> stage;
        try {
            stage = function.apply(args);
            if (stage == null) {
                throw new NullPointerException("function returned a null stage for key: " + key);
            }
        } catch (Throwable t) {
            settle(flight, null, t);
            return result;
        }
        stage.whenComplete((value, failure) -> settle(flight, value, failure));
        return result;
    }

    /**
     * Records the outcome of a flight and hands it to every waiter. The store write and the removal
     * from the registry happen together under the lock; a flight that is no longer registered was
     * cancelled and its outcome is dropped.
     */
    private void settle(Flight flight, Object value, Throwable failure) {
        Throwable cause = unwrap(failure);
        boolean registered;
        lock.lock();
        try {
            registered = inflight.get(flight.key()) == flight;
            if (registered) {
                inflight.remove(flight.key());
                long now = ticker.read();
                if (cause == null) {
                    store.put(flight.key(), value, now);
                    loadSuccessCount.incrementAndGet();
                } else {
                    loadFailureCount.incrementAndGet();
                }
                totalLoadTime.addAndGet(now - flight.startNanos());
            }
        } finally {
            lock.unlock();
        }

        if (!registered) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Dropping outcome of cancelled flight: key=" + flight.key());
            }
            return;
        }
        if (cause == null) {
            flight.succeed(value);
        } else {
            flight.fail(cause);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    // Management

    @Override
    public void invalidate(Arguments args) {
        CacheKey key = KeyNormalizer.normalize(args);
        lock.lock();
        try {
            store.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CompletableFuture<Void> invalidateAsync(Arguments args) {
        CacheKey key = KeyNormalizer.normalize(args);
        Flight cancelled;
        lock.lock();
        try {
            store.remove(key);
            cancelled = inflight.remove(key);
        } finally {
            lock.unlock();
        }
        if (cancelled != null && cancelled.cancel("Flight invalidated")) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Cancelled flight on invalidation: key=" + key);
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void clear() {
        List<Flight> cancelled;
        lock.lock();
        try {
            store.clear();
            hitCount.set(0);
            missCount.set(0);
            loadSuccessCount.set(0);
            loadFailureCount.set(0);
            totalLoadTime.set(0);
            evictionCount.set(0);
            cancelled = new ArrayList<>(inflight.values());
            inflight.clear();
        } finally {
            lock.unlock();
        }
        for (Flight flight : cancelled) {
            flight.cancel("Cache cleared");
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Cleared cache, cancelled " + cancelled.size() + " flight(s)");
        }
    }

    @Override
    public void cleanUp() {
        lock.lock();
        try {
            store.cleanUp(ticker.read());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheInfo info() {
        lock.lock();
        try {
            return new CacheInfo(hitCount.get(), missCount.get(), store.size(), maximumSize, ttl, inflight.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(
                    hitCount.get(),
                    missCount.get(),
                    loadSuccessCount.get(),
                    loadFailureCount.get(),
                    totalLoadTime.get(),
                    evictionCount.get()
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the stored keys from least to most recently used.
     */
    public List<CacheKey> keysInRecencyOrder() {
        lock.lock();
        try {
            return store.keysInRecencyOrder();
        } finally {
            lock.unlock();
        }
    }

    // Called by the store with the lock held
    private void onRemoval(CacheKey key, Object value, RemovalCause cause) {
        if (cause.wasEvicted()) {
            evictionCount.incrementAndGet();
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry: key=" + key + ", cause=" + cause + ", size=" + store.size());
            }
        }
        if (removalListener != null) {
            try {
                removalListener.onRemoval(key, value, cause);
            } catch (Exception e) {
                // Log and swallow exceptions from listener
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + key +
                          ", cause: " + cause, e);
            }
        }
    }

    // CacheMetrics interface implementation for Micrometer integration

    @Override
    public long hitCount() {
        return hitCount.get();
    }

    @Override
    public long missCount() {
        return missCount.get();
    }

    @Override
    public long evictionCount() {
        return evictionCount.get();
    }

    @Override
    public long loadSuccessCount() {
        return loadSuccessCount.get();
    }

    @Override
    public long loadFailureCount() {
        return loadFailureCount.get();
    }

    @Override
    public long totalLoadTimeNanos() {
        return totalLoadTime.get();
    }

    @Override
    public long maximumSize() {
        return maximumSize;
    }

    @Override
    public int inflightCount() {
        lock.lock();
        try {
            return inflight.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "MemoCacheImpl{maximumSize=" + maximumSize + ", ttl=" + ttl + ", ticker=" + ticker + '}';
    }
}
