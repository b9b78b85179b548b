package com.github.rudygunawan.memo.key;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The arguments of one memoized call: an ordered list of positional values and a set of named
 * values. Instances are immutable; {@link #with(String, Object)} returns a copy.
 *
 * <p>Both positional and named values may be {@code null}.
 *
 * <pre>{@code
 * Arguments args = Arguments.of("user-42", 3).with("locale", Locale.UK);
 * String id = (String) args.get(0);
 * Locale locale = (Locale) args.get("locale");
 * }</pre>
 */
public final class Arguments {

    private static final Arguments EMPTY = new Arguments(Collections.emptyList(), Collections.emptyMap());

    private final List<Object> positional;
    private final Map<String, Object> named;

    private Arguments(List<Object> positional, Map<String, Object> named) {
        this.positional = positional;
        this.named = named;
    }

    /**
     * Returns an argument set with no positional and no named values.
     */
    public static Arguments empty() {
        return EMPTY;
    }

    /**
     * Creates an argument set from positional values.
     *
     * @param positional the positional values, in call order
     * @return the argument set
     */
    public static Arguments of(Object... positional) {
        if (positional == null) {
            // a single null passed through varargs arrives as a null array
            return new Arguments(Collections.singletonList(null), Collections.emptyMap());
        }
        if (positional.length == 0) {
            return EMPTY;
        }
        return new Arguments(Collections.unmodifiableList(Arrays.asList(positional.clone())),
                Collections.emptyMap());
    }

    /**
     * Creates an argument set from positional values and named values.
     *
     * @param positional the positional values, in call order
     * @param named the named values
     * @return the argument set
     */
    public static Arguments of(List<?> positional, Map<String, ?> named) {
        Objects.requireNonNull(positional, "positional cannot be null");
        Objects.requireNonNull(named, "named cannot be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : named.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "argument name cannot be null"), entry.getValue());
        }
        return new Arguments(Collections.unmodifiableList(new ArrayList<>(positional)),
                Collections.unmodifiableMap(copy));
    }

    /**
     * Returns a copy of these arguments with the named value added or replaced.
     *
     * @param name the argument name
     * @param value the argument value, may be {@code null}
     * @return a new argument set
     */
    public Arguments with(String name, Object value) {
        Objects.requireNonNull(name, "name cannot be null");
        Map<String, Object> copy = new LinkedHashMap<>(named);
        copy.put(name, value);
        return new Arguments(positional, Collections.unmodifiableMap(copy));
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> named() {
        return named;
    }

    /**
     * Returns the positional value at {@code index}.
     *
     * @throws IndexOutOfBoundsException if there is no such positional argument
     */
    public Object get(int index) {
        return positional.get(index);
    }

    /**
     * Returns the named value for {@code name}, or {@code null} if it was not supplied.
     */
    public Object get(String name) {
        return named.get(name);
    }

    /**
     * Returns the number of positional arguments.
     */
    public int size() {
        return positional.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof Arguments)) {
            return false;
        }
        Arguments other = (Arguments) obj;
        return positional.equals(other.positional) && named.equals(other.named);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, named);
    }

    @Override
    public String toString() {
        return "Arguments{positional=" + positional + ", named=" + named + '}';
    }
}
