package com.github.rudygunawan.memo.key;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for argument normalization.
 */
class KeyNormalizerTest {

    record Point(int x, int y) {
    }

    record Tagged(String name, Set<String> tags) {
    }

    static final class Opaque {
        private final String label;

        Opaque(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return "Opaque(" + label + ")";
        }
    }

    @Test
    void testMapOrderDoesNotMatter() {
        Map<String, Integer> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", 2);
        Map<String, Integer> ba = new LinkedHashMap<>();
        ba.put("b", 2);
        ba.put("a", 1);

        assertEquals(KeyNormalizer.normalize(Arguments.of(ab)), KeyNormalizer.normalize(Arguments.of(ba)));
        assertEquals(KeyNormalizer.normalizeValue(ab), KeyNormalizer.normalizeValue(ba));
    }

    @Test
    void testSetOrderDoesNotMatter() {
        Set<Integer> ascending = new LinkedHashSet<>(List.of(1, 2, 3));
        Set<Integer> descending = new LinkedHashSet<>(List.of(3, 2, 1));

        assertEquals(KeyNormalizer.normalize(Arguments.of(ascending)),
                KeyNormalizer.normalize(Arguments.of(descending)));
    }

    @Test
    void testSequenceOrderMatters() {
        assertNotEquals(KeyNormalizer.normalize(Arguments.of(List.of(1, 2))),
                KeyNormalizer.normalize(Arguments.of(List.of(2, 1))));
        assertNotEquals(KeyNormalizer.normalize(Arguments.of(1, 2)), KeyNormalizer.normalize(Arguments.of(2, 1)));
    }

    @Test
    void testNamedArgumentOrderDoesNotMatter() {
        Arguments first = Arguments.of("query").with("limit", 10).with("offset", 20);
        Arguments second = Arguments.of("query").with("offset", 20).with("limit", 10);

        CacheKey key = KeyNormalizer.normalize(first);
        assertEquals(key, KeyNormalizer.normalize(second));
        assertEquals(key.hashCode(), KeyNormalizer.normalize(second).hashCode());
    }

    @Test
    void testPositionalAndNamedAreDistinct() {
        assertNotEquals(KeyNormalizer.normalize(Arguments.of(1)),
                KeyNormalizer.normalize(Arguments.empty().with("x", 1)));
    }

    @Test
    void testNumbersAreWidened() {
        Object fromInt = KeyNormalizer.normalizeValue(7);
        assertEquals(fromInt, KeyNormalizer.normalizeValue(7L));
        assertEquals(fromInt, KeyNormalizer.normalizeValue((short) 7));
        assertEquals(fromInt, KeyNormalizer.normalizeValue(BigInteger.valueOf(7)));
        assertEquals(KeyNormalizer.normalizeValue(new BigDecimal("1.50")), KeyNormalizer.normalizeValue(new BigDecimal("1.5")));
        assertEquals(KeyNormalizer.normalizeValue(0.0), KeyNormalizer.normalizeValue(-0.0));

        // integral and floating values stay apart
        assertNotEquals(fromInt, KeyNormalizer.normalizeValue(7.0));
    }

    @Test
    void testIntegerFloatAndBooleanKeysStayApart() {
        CacheKey one = KeyNormalizer.normalize(Arguments.of(1));
        CacheKey oneDouble = KeyNormalizer.normalize(Arguments.of(1.0));
        CacheKey yes = KeyNormalizer.normalize(Arguments.of(true));

        assertNotEquals(one, oneDouble);
        assertNotEquals(one, yes);
        assertNotEquals(oneDouble, yes);
    }

    @Test
    void testScalarsMapToThemselves() {
        assertNull(KeyNormalizer.normalizeValue(null));
        assertEquals("text", KeyNormalizer.normalizeValue("text"));
        assertEquals(Boolean.TRUE, KeyNormalizer.normalizeValue(true));
        assertEquals('c', KeyNormalizer.normalizeValue('c'));
    }

    @Test
    void testBytesCompareByContent() {
        assertEquals(KeyNormalizer.normalizeValue(new byte[]{1, 2, 3}), KeyNormalizer.normalizeValue(new byte[]{1, 2, 3}));
        assertNotEquals(KeyNormalizer.normalizeValue(new byte[]{1, 2, 3}), KeyNormalizer.normalizeValue(new byte[]{3, 2, 1}));
    }

    @Test
    void testArraysAndListsAreOrderedSequences() {
        assertEquals(KeyNormalizer.normalizeValue(new int[]{1, 2}), KeyNormalizer.normalizeValue(List.of(1, 2)));
        assertEquals(KeyNormalizer.normalizeValue(new String[]{"a", "b"}), KeyNormalizer.normalizeValue(Arrays.asList("a", "b")));
    }

    @Test
    void testSetsAndSequencesAreDistinct() {
        assertNotEquals(KeyNormalizer.normalizeValue(Set.of(1)), KeyNormalizer.normalizeValue(List.of(1)));
    }

    @Test
    void testRecordsNormalizeByComponents() {
        assertEquals(KeyNormalizer.normalizeValue(new Point(1, 2)), KeyNormalizer.normalizeValue(new Point(1, 2)));
        assertNotEquals(KeyNormalizer.normalizeValue(new Point(1, 2)), KeyNormalizer.normalizeValue(new Point(2, 1)));

        Tagged a = new Tagged("n", new LinkedHashSet<>(List.of("x", "y")));
        Tagged b = new Tagged("n", new LinkedHashSet<>(List.of("y", "x")));
        assertEquals(KeyNormalizer.normalizeValue(a), KeyNormalizer.normalizeValue(b));
    }

    @Test
    void testEnumsNormalizeByName() {
        Object seconds = KeyNormalizer.normalizeValue(TimeUnit.SECONDS);
        assertEquals(seconds, KeyNormalizer.normalizeValue(TimeUnit.valueOf("SECONDS")));
        assertNotEquals(seconds, KeyNormalizer.normalizeValue("SECONDS"));
    }

    @Test
    void testFallbackUsesText() {
        Object first = KeyNormalizer.normalizeValue(new Opaque("same"));
        Object second = KeyNormalizer.normalizeValue(new Opaque("same"));
        assertEquals(first, second, "distinct objects with equal text collide");
        assertNotEquals(first, KeyNormalizer.normalizeValue(new Opaque("other")));
    }

    @Test
    void testNestedStructures() {
        Map<String, Object> left = new HashMap<>();
        left.put("ids", new HashSet<>(List.of(3, 1, 2)));
        left.put("range", List.of(1, 10));
        left.put("meta", Map.of("z", true, "a", false));

        Map<String, Object> right = new TreeMap<>(Comparator.reverseOrder());
        right.put("meta", new LinkedHashMap<>(Map.of("a", false, "z", true)));
        right.put("range", new int[]{1, 10});
        right.put("ids", new TreeSet<>(List.of(2, 3, 1)));

        assertEquals(KeyNormalizer.normalizeValue(left), KeyNormalizer.normalizeValue(right));
    }

    @Test
    void testMixedSetIsSortedDeterministically() {
        Set<Object> mixed = new LinkedHashSet<>(Arrays.asList("b", 2, null, 1.5, "a", true));
        Set<Object> shuffled = new LinkedHashSet<>(Arrays.asList(true, "a", 1.5, null, 2, "b"));

        CanonicalForm form = (CanonicalForm) KeyNormalizer.normalizeValue(mixed);
        assertEquals(form, KeyNormalizer.normalizeValue(shuffled));
        assertEquals(CanonicalForm.Kind.SET, form.kind());
        assertEquals(Arrays.asList(null, true, 1.5, 2L, "a", "b"), form.parts());
    }

    @Test
    void testSelfReferenceIsRejected() {
        List<Object> loop = new ArrayList<>();
        loop.add(loop);

        assertThrows(IllegalArgumentException.class, () -> KeyNormalizer.normalizeValue(loop));
    }

    @Test
    void testRepeatedReferenceIsNotACycle() {
        List<Integer> shared = List.of(1, 2);

        Object form = KeyNormalizer.normalizeValue(List.of(shared, shared));
        assertEquals(KeyNormalizer.normalizeValue(List.of(List.of(1, 2), List.of(1, 2))), form);
    }

    @Test
    void testNullArguments() {
        assertEquals(KeyNormalizer.normalize(Arguments.of((Object) null)),
                KeyNormalizer.normalize(Arguments.of(Collections.singletonList(null), Map.of())));
        assertNotEquals(KeyNormalizer.normalize(Arguments.of((Object) null)), KeyNormalizer.normalize(Arguments.empty()));
    }
}
