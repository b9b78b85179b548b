package com.github.rudygunawan.memo.key;

import java.util.Collections;
import java.util.List;

/**
 * A normalized composite value produced by {@link KeyNormalizer}. Scalars normalize to plain Java
 * values; everything with structure normalizes to a {@code CanonicalForm} carrying its {@link Kind}
 * and its already-normalized parts.
 *
 * <p>Equality and hashing are structural, and {@link CanonicalOrder} imposes a total order so that
 * unordered containers can be sorted deterministically.
 */
public final class CanonicalForm {

    /**
     * The recognized structural shapes. The declaration order is part of the canonical ordering.
     */
    public enum Kind {
        /** Bytes, as a single lowercase hex string part. */
        BYTES,
        /** Enum constant, as declaring class name and constant name. */
        ENUM,
        /** Ordered sequence; order of parts is significant. */
        SEQUENCE,
        /** Unordered collection; parts are sorted. */
        SET,
        /** One mapping entry, as normalized key and normalized value. */
        ENTRY,
        /** Mapping; parts are {@link #ENTRY} forms sorted by key. */
        MAPPING,
        /** Record, as class name and a {@link #MAPPING} of its components. */
        RECORD,
        /** Textual fallback for values outside the recognized shapes. */
        TEXT
    }

    private final Kind kind;
    private final List<Object> parts;
    private final int hash;

    CanonicalForm(Kind kind, List<Object> parts) {
        this.kind = kind;
        this.parts = Collections.unmodifiableList(parts);
        this.hash = 31 * kind.ordinal() + this.parts.hashCode();
    }

    public Kind kind() {
        return kind;
    }

    public List<Object> parts() {
        return parts;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CanonicalForm)) {
            return false;
        }
        CanonicalForm other = (CanonicalForm) obj;
        return hash == other.hash && kind == other.kind && parts.equals(other.parts);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return kind + parts.toString();
    }
}
