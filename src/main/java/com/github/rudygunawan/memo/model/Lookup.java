package com.github.rudygunawan.memo.model;

/**
 * The outcome of a store lookup: the key was absent, present but stale, or a fresh hit.
 *
 * <p>A stale lookup has already removed the entry from the store.
 *
 * @param <V> the type of the cached value
 */
public final class Lookup<V> {

    private static final Lookup<?> ABSENT = new Lookup<>(false, false, null);
    private static final Lookup<?> EXPIRED = new Lookup<>(true, false, null);

    private final boolean found;
    private final boolean fresh;
    private final V value;

    private Lookup(boolean found, boolean fresh, V value) {
        this.found = found;
        this.fresh = fresh;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <V> Lookup<V> absent() {
        return (Lookup<V>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    public static <V> Lookup<V> expired() {
        return (Lookup<V>) EXPIRED;
    }

    public static <V> Lookup<V> hit(V value) {
        return new Lookup<>(true, true, value);
    }

    /**
     * Returns true if the key was in the store, fresh or not.
     */
    public boolean isFound() {
        return found;
    }

    /**
     * Returns true if the key was in the store and within its time-to-live.
     */
    public boolean isFresh() {
        return fresh;
    }

    /**
     * Returns true for a fresh hit, the only case in which {@link #getValue()} is meaningful.
     */
    public boolean isHit() {
        return found && fresh;
    }

    public V getValue() {
        return value;
    }

    @Override
    public String toString() {
        if (isHit()) {
            return "Lookup.hit(" + value + ")";
        }
        return found ? "Lookup.expired()" : "Lookup.absent()";
    }
}
