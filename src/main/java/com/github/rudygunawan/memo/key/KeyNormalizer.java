package com.github.rudygunawan.memo.key;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reduces call arguments to a canonical, hashable {@link CacheKey}.
 *
 * <p>The reduction is a closed function over a small set of recognized shapes:
 * <ul>
 *   <li><b>Scalars</b> map to themselves, with numbers widened so that equal values of different
 *       boxed types collide: {@code Byte}, {@code Short}, {@code Integer}, {@code Long} and
 *       {@code BigInteger} become {@code Long} (or {@code BigInteger} outside the long range),
 *       {@code Float} and {@code Double} become {@code Double}, {@code BigDecimal} loses trailing
 *       zeros. Integral and floating values are never equal to each other, and booleans are not
 *       numbers: {@code 1}, {@code 1.0} and {@code true} are three distinct keys, unlike
 *       dynamically typed memoizers that treat them as one.</li>
 *   <li><b>Ordered sequences</b> ({@code List}, arrays, other non-set collections) keep their order.</li>
 *   <li><b>Sets</b> are sorted with {@link CanonicalOrder}, so iteration order never affects the key.</li>
 *   <li><b>Maps</b> become entries sorted by normalized key.</li>
 *   <li><b>Records</b> become their type name plus the mapping of component names to values.</li>
 *   <li><b>Anything else</b> falls back to {@link String#valueOf(Object)}. Two distinct objects with
 *       the same text share a key; callers who need identity semantics should pass an identifier
 *       instead of the object.</li>
 * </ul>
 *
 * <p>Normalization is deterministic and has no side effects. The only input it rejects is a
 * container that contains itself.
 */
public final class KeyNormalizer {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private KeyNormalizer() {
    }

    /**
     * Derives the cache key for a call.
     *
     * @param arguments the call arguments
     * @return the canonical key
     */
    public static CacheKey normalize(Arguments arguments) {
        Objects.requireNonNull(arguments, "arguments cannot be null");
        return normalize(arguments.positional(), arguments.named());
    }

    /**
     * Derives the cache key from positional and named values.
     *
     * @param positional the positional values, order significant
     * @param named the named values, order not significant
     * @return the canonical key
     */
    public static CacheKey normalize(List<?> positional, Map<String, ?> named) {
        Objects.requireNonNull(positional, "positional cannot be null");
        Objects.requireNonNull(named, "named cannot be null");
        Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<>());
        CanonicalForm positionalForm = sequence(positional, path);
        CanonicalForm namedForm = mapping(named, path);
        return new CacheKey(positionalForm, namedForm);
    }

    /**
     * Normalizes a single value.
     *
     * @param value any value, may be {@code null}
     * @return a scalar or a {@link CanonicalForm}
     * @throws IllegalArgumentException if {@code value} contains itself
     */
    public static Object normalizeValue(Object value) {
        return normalize(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static Object normalize(Object value, Set<Object> path) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Character) {
            return value;
        }
        if (value instanceof Number) {
            return normalizeNumber((Number) value);
        }
        if (value instanceof Enum) {
            Enum<?> constant = (Enum<?>) value;
            return form(CanonicalForm.Kind.ENUM,
                    List.of(constant.getDeclaringClass().getName(), constant.name()));
        }
        if (value instanceof byte[]) {
            return form(CanonicalForm.Kind.BYTES, List.of(HexFormat.of().formatHex((byte[]) value)));
        }
        if (value instanceof Set || value instanceof Map || value instanceof Collection
                || value instanceof Record || value.getClass().isArray()) {
            if (!path.add(value)) {
                throw new IllegalArgumentException(
                        "Cannot normalize self-referential " + value.getClass().getName());
            }
            try {
                return normalizeContainer(value, path);
            } finally {
                path.remove(value);
            }
        }
        return form(CanonicalForm.Kind.TEXT, List.of(String.valueOf(value)));
    }

    private static Object normalizeContainer(Object value, Set<Object> path) {
        if (value instanceof Set) {
            List<Object> elements = new ArrayList<>();
            for (Object element : (Set<?>) value) {
                elements.add(normalize(element, path));
            }
            elements.sort(CanonicalOrder.INSTANCE);
            return form(CanonicalForm.Kind.SET, elements);
        }
        if (value instanceof Map) {
            return mapping((Map<?, ?>) value, path);
        }
        if (value instanceof Collection) {
            return sequence((Collection<?>) value, path);
        }
        if (value instanceof Record) {
            return record((Record) value, path);
        }
        int length = Array.getLength(value);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(normalize(Array.get(value, i), path));
        }
        return form(CanonicalForm.Kind.SEQUENCE, elements);
    }

    private static CanonicalForm sequence(Collection<?> values, Set<Object> path) {
        List<Object> elements = new ArrayList<>(values.size());
        for (Object element : values) {
            elements.add(normalize(element, path));
        }
        return form(CanonicalForm.Kind.SEQUENCE, elements);
    }

    private static CanonicalForm mapping(Map<?, ?> map, Set<Object> path) {
        List<Object> entries = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            List<Object> pair = new ArrayList<>(2);
            pair.add(normalize(entry.getKey(), path));
            pair.add(normalize(entry.getValue(), path));
            entries.add(form(CanonicalForm.Kind.ENTRY, pair));
        }
        entries.sort(CanonicalOrder.INSTANCE);
        return form(CanonicalForm.Kind.MAPPING, entries);
    }

    private static CanonicalForm record(Record record, Set<Object> path) {
        RecordComponent[] components = record.getClass().getRecordComponents();
        List<Object> entries = new ArrayList<>(components.length);
        for (RecordComponent component : components) {
            Object componentValue;
            try {
                component.getAccessor().setAccessible(true);
                componentValue = component.getAccessor().invoke(record);
            } catch (IllegalAccessException | InvocationTargetException | RuntimeException e) {
                // inaccessible accessor: fall back to the record's own text
                return form(CanonicalForm.Kind.TEXT, List.of(String.valueOf(record)));
            }
            List<Object> pair = new ArrayList<>(2);
            pair.add(component.getName());
            pair.add(normalize(componentValue, path));
            entries.add(form(CanonicalForm.Kind.ENTRY, pair));
        }
        entries.sort(CanonicalOrder.INSTANCE);
        return form(CanonicalForm.Kind.RECORD,
                List.of(record.getClass().getName(), form(CanonicalForm.Kind.MAPPING, entries)));
    }

    private static Object normalizeNumber(Number number) {
        if (number instanceof Long) {
            return number;
        }
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            // 0.0 and -0.0 are the same argument
            return d == 0.0d ? 0.0d : d;
        }
        if (number instanceof BigInteger) {
            BigInteger big = (BigInteger) number;
            if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
                return big.longValue();
            }
            return big;
        }
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).stripTrailingZeros();
        }
        return form(CanonicalForm.Kind.TEXT, List.of(String.valueOf(number)));
    }

    private static CanonicalForm form(CanonicalForm.Kind kind, List<Object> parts) {
        return new CanonicalForm(kind, parts);
    }
}
