package com.github.rudygunawan.memo.builder;

import com.github.rudygunawan.memo.api.MemoCache;
import com.github.rudygunawan.memo.impl.MemoCacheImpl;
import com.github.rudygunawan.memo.listener.RemovalListener;
import com.github.rudygunawan.memo.time.Ticker;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A builder of {@link MemoCache} instances.
 *
 * <p>Every cache is bounded: it holds at most {@link #maximumSize(long)} results (128 unless set)
 * and evicts the least recently used one when a new result would exceed the limit. Results can
 * additionally expire a fixed time after they were stored. The configuration is fixed once
 * {@link #build()} is called.
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoCache prices = MemoCacheBuilder.newBuilder()
 *     .maximumSize(10_000)
 *     .expireAfterWrite(30, TimeUnit.SECONDS)
 *     .build();
 *
 * Quote quote = prices.call(args -> exchange.quote((String) args.get(0)), "AAPL");
 * }</pre>
 */
public class MemoCacheBuilder {
    /** Default capacity when {@link #maximumSize(long)} is not called. */
    public static final long DEFAULT_MAXIMUM_SIZE = 128;

    private long maximumSize = DEFAULT_MAXIMUM_SIZE;
    private Duration expireAfterWrite;
    private Ticker ticker = Ticker.systemTicker();
    private RemovalListener removalListener;

    private MemoCacheBuilder() {
    }

    /**
     * Constructs a new {@code MemoCacheBuilder} instance with default settings.
     */
    public static MemoCacheBuilder newBuilder() {
        return new MemoCacheBuilder();
    }

    /**
     * Specifies the maximum number of results the cache may hold. When a new result would exceed
     * it, the least recently used result is evicted.
     *
     * @param size the maximum size of the cache
     * @return this builder instance
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public MemoCacheBuilder maximumSize(long size) {
        if (size <= 0) {
            throw new IllegalArgumentException("maximum size must be positive, was " + size);
        }
        this.maximumSize = size;
        return this;
    }

    /**
     * Specifies that each result should be treated as absent once a fixed duration has elapsed
     * since it was stored. Expired results are removed lazily, by the next call that looks them up
     * or by {@link MemoCache#cleanUp()}.
     *
     * @param duration the length of time after a result is stored that it expires
     * @param unit the unit that {@code duration} is expressed in
     * @return this builder instance
     * @throws IllegalArgumentException if {@code duration} is not positive
     */
    public MemoCacheBuilder expireAfterWrite(long duration, TimeUnit unit) {
        Objects.requireNonNull(unit, "unit cannot be null");
        if (duration <= 0) {
            throw new IllegalArgumentException("duration must be positive, was " + duration);
        }
        this.expireAfterWrite = Duration.ofNanos(unit.toNanos(duration));
        return this;
    }

    /**
     * Same as {@link #expireAfterWrite(long, TimeUnit)} with a {@link Duration}. Durations too long
     * to express in nanoseconds, such as {@code ChronoUnit.FOREVER.getDuration()}, are accepted and
     * behave as the longest representable time-to-live.
     *
     * @param duration the time-to-live of each result
     * @return this builder instance
     * @throws IllegalArgumentException if {@code duration} is zero or negative
     */
    public MemoCacheBuilder expireAfterWrite(Duration duration) {
        Objects.requireNonNull(duration, "duration cannot be null");
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be positive, was " + duration);
        }
        this.expireAfterWrite = duration;
        return this;
    }

    /**
     * Specifies the time source used to stamp and age results. Defaults to
     * {@link Ticker#systemTicker()}; tests pass a ticker they can advance by hand.
     *
     * @param ticker the time source
     * @return this builder instance
     */
    public MemoCacheBuilder ticker(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        return this;
    }

    /**
     * Specifies a listener notified whenever a result leaves the cache, for any reason.
     *
     * @param listener the removal listener
     * @return this builder instance
     */
    public MemoCacheBuilder removalListener(RemovalListener listener) {
        this.removalListener = Objects.requireNonNull(listener, "listener cannot be null");
        return this;
    }

    /**
     * Builds a cache with the configured settings.
     *
     * @return a new cache
     */
    public MemoCache build() {
        return new MemoCacheImpl(this);
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    /**
     * Returns the time-to-live, or {@code null} if results never expire.
     */
    public Duration getExpireAfterWrite() {
        return expireAfterWrite;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public RemovalListener getRemovalListener() {
        return removalListener;
    }
}
