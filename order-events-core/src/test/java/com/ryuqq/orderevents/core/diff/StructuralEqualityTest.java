package com.ryuqq.orderevents.core.diff;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class StructuralEqualityTest {

    @Test
    void equal_NumbersCompareByValue() {
        assertTrue(StructuralEquality.equal(1, 1.0));
        assertTrue(StructuralEquality.equal(1L, new BigDecimal("1.00")));
        assertFalse(StructuralEquality.equal(1, 1.5));
        assertTrue(StructuralEquality.equal(Double.NaN, Double.NaN));
    }

    @Test
    void equal_MapsIgnoreKeyOrder() {
        Map<String, Object> left = new LinkedHashMap<>();
        left.put("a", 1);
        left.put("b", List.of("x"));
        Map<String, Object> right = new TreeMap<>(Map.of("b", List.of("x"), "a", 1.0));

        assertTrue(StructuralEquality.equal(left, right));
    }

    @Test
    void equal_MissingKeyDiffersFromNullValue() {
        Map<String, Object> withNull = new LinkedHashMap<>();
        withNull.put("a", null);

        assertFalse(StructuralEquality.equal(withNull, Map.of()));
        assertFalse(StructuralEquality.equal(Map.of("a", 1), Map.of("b", 1)));
    }

    @Test
    void equal_ListsArePositional() {
        assertTrue(StructuralEquality.equal(List.of(1, 2), List.of(1, 2)));
        assertFalse(StructuralEquality.equal(List.of(1, 2), List.of(2, 1)));
        assertFalse(StructuralEquality.equal(List.of(1), List.of(1, 1)));
    }

    @Test
    void equal_NullAndTypeMismatch() {
        assertTrue(StructuralEquality.equal(null, null));
        assertFalse(StructuralEquality.equal(null, "a"));
        assertFalse(StructuralEquality.equal("1", 1));
        assertFalse(StructuralEquality.equal(List.of(), Map.of()));
    }

    @Test
    void multisetEqual_IgnoresOrderButCountsDuplicates() {
        assertTrue(StructuralEquality.multisetEqual(List.of("a", "b", "a"), List.of("a", "a", "b")));
        assertFalse(StructuralEquality.multisetEqual(List.of("a", "b", "b"), List.of("a", "a", "b")));
        assertTrue(StructuralEquality.multisetEqual(
            List.of(Map.of("id", 1), Map.of("id", 2)),
            List.of(Map.of("id", 2.0), Map.of("id", 1))
        ));
        assertTrue(StructuralEquality.multisetEqual(Arrays.asList(null, "a"), Arrays.asList("a", null)));
        assertFalse(StructuralEquality.multisetEqual(List.of("a"), null));
    }
}
