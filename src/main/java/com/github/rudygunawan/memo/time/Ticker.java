package com.github.rudygunawan.memo.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>The memo cache reads the ticker when an entry is written and again when it is looked up, so the
 * difference between the two readings is the age of the entry. Tests substitute a ticker they control
 * in order to exercise time-to-live expiry without sleeping.
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * MemoCache cache = MemoCacheBuilder.newBuilder()
 *     .ticker(ticker)
 *     .expireAfterWrite(10, TimeUnit.MINUTES)
 *     .build();
 *
 * cache.call(args -> loadUser(args.get(0)), "user1");
 *
 * // Advance time by 11 minutes, the next call recomputes
 * ticker.advance(11, TimeUnit.MINUTES);
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * <p>Implementations must behave like {@link System#nanoTime()}: monotonic and unrelated to
     * wall-clock time.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return a ticker that uses the system's nanosecond-precision clock
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
