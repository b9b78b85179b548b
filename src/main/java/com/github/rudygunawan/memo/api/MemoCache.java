package com.github.rudygunawan.memo.api;

import com.github.rudygunawan.memo.builder.MemoCacheBuilder;
import com.github.rudygunawan.memo.key.Arguments;
import com.github.rudygunawan.memo.model.CacheInfo;
import com.github.rudygunawan.memo.model.CacheStats;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A memoizing cache: given a computation and its arguments, returns the stored result for those
 * arguments if it is still fresh, otherwise computes, stores and returns it.
 *
 * <p>Results are keyed on the arguments only, after normalization by
 * {@link com.github.rudygunawan.memo.key.KeyNormalizer}. The computation is not part of the key, so
 * a cache instance should memoize one logical function; use one instance per function to keep their
 * results apart.
 *
 * <p>There are two call paths over the same bounded LRU store:
 * <ul>
 *   <li>{@link #call} blocks the calling thread while the computation runs. Concurrent misses for
 *       the same arguments may each compute; the last one to finish wins.</li>
 *   <li>{@link #callAsync} returns a {@link CompletableFuture}. Concurrent misses for the same
 *       arguments share one computation (single flight) and all observe its outcome.</li>
 * </ul>
 *
 * <p>Implementations are thread-safe. Computations always run outside the cache's lock.
 *
 * <p><b>Example usage:</b>
 * <pre>{@code
 * MemoCache cache = MemoCache.create(2);
 *
 * cache.call(args -> square((Integer) args.get(0)), 1);  // miss, computes
 * cache.call(args -> square((Integer) args.get(0)), 1);  // hit
 * }</pre>
 */
public interface MemoCache {

    /**
     * Creates a cache holding at most {@code maximumSize} results that never expire.
     *
     * @throws IllegalArgumentException if {@code maximumSize} is not positive
     */
    static MemoCache create(long maximumSize) {
        return MemoCacheBuilder.newBuilder().maximumSize(maximumSize).build();
    }

    /**
     * Creates a cache holding at most {@code maximumSize} results that expire {@code ttl} after
     * they were stored.
     *
     * @throws IllegalArgumentException if {@code maximumSize} or {@code ttl} is not positive
     */
    static MemoCache create(long maximumSize, Duration ttl) {
        return MemoCacheBuilder.newBuilder().maximumSize(maximumSize).expireAfterWrite(ttl).build();
    }

    /**
     * Returns the memoized result of {@code function} for {@code args}, computing it on the calling
     * thread if there is no fresh result.
     *
     * @param function the computation, invoked outside the cache's lock
     * @param args the call arguments, which determine the cache key
     * @param <V> the type of the result
     * @return the cached or computed result
     * @throws Exception exactly what {@code function} threw; nothing is cached in that case
     */
    <V> V call(CachedFunction<? extends V> function, Arguments args) throws Exception;

    /**
     * Same as {@link #call(CachedFunction, Arguments)} with positional arguments only.
     */
    default <V> V call(CachedFunction<? extends V> function, Object... args) throws Exception {
        return call(function, Arguments.of(args));
    }

    /**
     * Returns a future of the memoized result of {@code function} for {@code args}.
     *
     * <p>If a fresh result is stored the future is already complete. If another caller is already
     * computing the result for equal arguments, the returned future completes with that
     * computation's outcome. Otherwise {@code function} is invoked on the calling thread and the
     * returned future follows the stage it returns.
     *
     * <p>A failure completes the future exceptionally with the original exception as cause and is
     * not cached. If the computation is discarded by {@link #invalidateAsync} or {@link #clear}, the
     * future is cancelled: {@code isCancelled()} returns true and {@code get()} or {@code join()}
     * throw the {@link FlightCancelledException}.
     *
     * @param function the asynchronous computation
     * @param args the call arguments, which determine the cache key
     * @param <V> the type of the result
     * @return a future of the cached or computed result
     */
    <V> CompletableFuture<V> callAsync(AsyncCachedFunction<V> function, Arguments args);

    /**
     * Same as {@link #callAsync(AsyncCachedFunction, Arguments)} with positional arguments only.
     */
    default <V> CompletableFuture<V> callAsync(AsyncCachedFunction<V> function, Object... args) {
        return callAsync(function, Arguments.of(args));
    }

    /**
     * Returns a function that routes every invocation of {@code function} through {@link #call}.
     */
    default <V> CachedFunction<V> memoize(CachedFunction<V> function) {
        return args -> call(function, args);
    }

    /**
     * Returns a one-argument function that memoizes {@code function} in this cache. Unchecked
     * exceptions thrown by {@code function} propagate unchanged.
     */
    default <T, R> Function<T, R> memoizeFunction(Function<? super T, ? extends R> function) {
        CachedFunction<R> adapted = args -> {
            @SuppressWarnings("unchecked")
            T argument = (T) args.get(0);
            return function.apply(argument);
        };
        return argument -> callUnchecked(adapted, Arguments.of(argument));
    }

    /**
     * Returns a two-argument function that memoizes {@code function} in this cache. Unchecked
     * exceptions thrown by {@code function} propagate unchanged.
     */
    default <T, U, R> BiFunction<T, U, R> memoizeBiFunction(BiFunction<? super T, ? super U, ? extends R> function) {
        CachedFunction<R> adapted = args -> {
            @SuppressWarnings("unchecked")
            T first = (T) args.get(0);
            @SuppressWarnings("unchecked")
            U second = (U) args.get(1);
            return function.apply(first, second);
        };
        return (first, second) -> callUnchecked(adapted, Arguments.of(first, second));
    }

    /**
     * Returns a function that routes every invocation of {@code function} through {@link #callAsync}.
     */
    default <V> AsyncCachedFunction<V> memoizeAsync(AsyncCachedFunction<V> function) {
        return args -> callAsync(function, args);
    }

    /**
     * Discards the stored result for {@code args}, if any. A computation in flight for the same
     * arguments is left alone; use {@link #invalidateAsync} to discard it too.
     */
    void invalidate(Arguments args);

    /**
     * Same as {@link #invalidate(Arguments)} with positional arguments only.
     */
    default void invalidate(Object... args) {
        invalidate(Arguments.of(args));
    }

    /**
     * Discards the stored result for {@code args} and cancels the asynchronous computation in flight
     * for them, if any. Callers waiting on that computation receive a {@link FlightCancelledException}.
     * The computation itself is not interrupted.
     *
     * @return a future that is already complete when this method returns
     */
    CompletableFuture<Void> invalidateAsync(Arguments args);

    /**
     * Same as {@link #invalidateAsync(Arguments)} with positional arguments only.
     */
    default CompletableFuture<Void> invalidateAsync(Object... args) {
        return invalidateAsync(Arguments.of(args));
    }

    /**
     * Discards every stored result, resets all statistics to zero and cancels every asynchronous
     * computation in flight without waiting for them.
     */
    void clear();

    /**
     * Removes expired results now instead of on their next lookup.
     */
    void cleanUp();

    /**
     * Returns the number of stored results, possibly including expired ones not yet observed.
     */
    long size();

    /**
     * Returns a consistent snapshot of hits, misses, size, limits and the in-flight count.
     */
    CacheInfo info();

    /**
     * Returns a snapshot of the cumulative statistics since construction or the last {@link #clear}.
     */
    CacheStats stats();

    private <V> V callUnchecked(CachedFunction<V> function, Arguments args) {
        try {
            return call(function, args);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // a java.util.function adapter cannot throw a checked exception
            throw new IllegalStateException(e);
        }
    }
}
