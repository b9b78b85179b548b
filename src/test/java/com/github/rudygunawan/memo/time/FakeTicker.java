package com.github.rudygunawan.memo.time;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A fake {@link Ticker} implementation for testing time-to-live expiry.
 *
 * <p>This ticker allows you to manually control time progression in tests, making it possible
 * to test expiration without waiting for wall-clock time to pass.
 *
 * <p>This class is thread-safe and can be used in concurrent tests.
 */
public class FakeTicker implements Ticker {

    private final AtomicLong nanos;

    /**
     * Creates a new fake ticker starting at time zero.
     */
    public FakeTicker() {
        this.nanos = new AtomicLong(0);
    }

    /**
     * Advances the ticker by the specified duration.
     *
     * @param duration the amount of time to advance
     * @param unit the time unit of the duration
     * @return this ticker, for method chaining
     */
    public FakeTicker advance(long duration, TimeUnit unit) {
        return advance(unit.toNanos(duration));
    }

    /**
     * Advances the ticker by the specified number of nanoseconds. Negative values are ignored.
     *
     * @param nanoseconds the number of nanoseconds to advance
     * @return this ticker, for method chaining
     */
    public FakeTicker advance(long nanoseconds) {
        if (nanoseconds > 0) {
            nanos.addAndGet(nanoseconds);
        }
        return this;
    }

    @Override
    public long read() {
        return nanos.get();
    }

    @Override
    public String toString() {
        return "FakeTicker(" + nanos.get() + " ns)";
    }
}
