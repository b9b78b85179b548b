package com.github.rudygunawan.memo.key;

/**
 * The identity of a memoized call, derived by {@link KeyNormalizer} from its {@link Arguments}.
 *
 * <p>Keys are immutable and compare structurally. The hash is computed once at construction.
 */
public final class CacheKey {

    private final CanonicalForm positional;
    private final CanonicalForm named;
    private final int hash;

    CacheKey(CanonicalForm positional, CanonicalForm named) {
        this.positional = positional;
        this.named = named;
        this.hash = 31 * positional.hashCode() + named.hashCode();
    }

    /**
     * Returns the normalized positional arguments, a {@link CanonicalForm.Kind#SEQUENCE}.
     */
    public CanonicalForm positional() {
        return positional;
    }

    /**
     * Returns the normalized named arguments, a {@link CanonicalForm.Kind#MAPPING}.
     */
    public CanonicalForm named() {
        return named;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheKey)) {
            return false;
        }
        CacheKey other = (CacheKey) obj;
        return hash == other.hash && positional.equals(other.positional) && named.equals(other.named);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "CacheKey" + positional.parts() + named.parts();
    }
}
