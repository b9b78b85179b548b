package com.github.rudygunawan.memo.key;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;

/**
 * Total order over normalized values, used to sort the elements of sets and the entries of maps.
 *
 * <p>Values are ranked by category first: {@code null}, booleans, numbers, characters, strings and
 * finally {@link CanonicalForm}s (by {@link CanonicalForm.Kind}, then part by part). Numbers of
 * different types are compared by numeric value, with ties broken by type so that the order stays
 * consistent with {@code equals}.
 *
 * <p>Only the value types produced by {@link KeyNormalizer} are supported.
 */
public final class CanonicalOrder implements Comparator<Object> {

    public static final CanonicalOrder INSTANCE = new CanonicalOrder();

    private CanonicalOrder() {
    }

    @Override
    public int compare(Object a, Object b) {
        int categoryA = category(a);
        int categoryB = category(b);
        if (categoryA != categoryB) {
            return Integer.compare(categoryA, categoryB);
        }
        switch (categoryA) {
            case 0:
                return 0;
            case 1:
                return Boolean.compare((Boolean) a, (Boolean) b);
            case 2:
                return compareNumbers((Number) a, (Number) b);
            case 3:
                return Character.compare((Character) a, (Character) b);
            case 4:
                return ((String) a).compareTo((String) b);
            default:
                return compareForms((CanonicalForm) a, (CanonicalForm) b);
        }
    }

    private static int category(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Boolean) {
            return 1;
        }
        if (value instanceof Number) {
            return 2;
        }
        if (value instanceof Character) {
            return 3;
        }
        if (value instanceof String) {
            return 4;
        }
        if (value instanceof CanonicalForm) {
            return 5;
        }
        throw new IllegalArgumentException("Not a normalized value: " + value.getClass().getName());
    }

    private int compareForms(CanonicalForm a, CanonicalForm b) {
        int byKind = a.kind().compareTo(b.kind());
        if (byKind != 0) {
            return byKind;
        }
        List<Object> left = a.parts();
        List<Object> right = b.parts();
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int c = compare(left.get(i), right.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareNumbers(Number a, Number b) {
        int byValue = compareNumericValue(a, b);
        if (byValue != 0) {
            return byValue;
        }
        return Integer.compare(numberRank(a), numberRank(b));
    }

    private static int compareNumericValue(Number a, Number b) {
        boolean aSpecial = isNonFinite(a);
        boolean bSpecial = isNonFinite(b);
        if (aSpecial || bSpecial) {
            // -Infinity < finite < +Infinity < NaN, which is what Double.compare gives
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isNonFinite(Number n) {
        return n instanceof Double && !Double.isFinite(n.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        if (n instanceof Double) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private static int numberRank(Number n) {
        if (n instanceof Long) {
            return 0;
        }
        if (n instanceof BigInteger) {
            return 1;
        }
        if (n instanceof BigDecimal) {
            return 2;
        }
        return 3;
    }
}
