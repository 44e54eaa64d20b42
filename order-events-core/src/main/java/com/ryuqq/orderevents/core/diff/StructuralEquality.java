package com.ryuqq.orderevents.core.diff;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON 형태 값(Map, List, Number, String, Boolean, null)의 구조적 동등성 비교.
 *
 * <p>저장소나 파서가 만든 컬렉션 구현체에 의존하지 않도록 순수 함수로 구현합니다.</p>
 *
 * <p><strong>비교 규칙:</strong></p>
 * <ul>
 *   <li>Map: 키 집합이 같고 각 값이 재귀적으로 같음 (키 순서 무관)</li>
 *   <li>List: 길이가 같고 같은 위치의 원소가 재귀적으로 같음</li>
 *   <li>Number: 수치 비교 (1 == 1.0 == 1L)</li>
 *   <li>그 외: equals</li>
 * </ul>
 *
 * <p>{@link #multisetEqual(List, List)}는 순서를 무시하고 원소의 다중집합을 비교합니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public final class StructuralEquality {

    // Utility class - prevent instantiation
    private StructuralEquality() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 두 값이 구조적으로 같은지 비교.
     *
     * @param left 왼쪽 값 (null 허용)
     * @param right 오른쪽 값 (null 허용)
     * @return 구조적으로 같으면 true
     */
    public static boolean equal(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number l && right instanceof Number r) {
            return numbersEqual(l, r);
        }
        if (left instanceof Map<?, ?> l && right instanceof Map<?, ?> r) {
            return mapsEqual(l, r);
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            return listsEqual(l, r);
        }
        return left.equals(right);
    }

    /**
     * 두 목록이 순서와 무관하게 같은 원소를 같은 개수만큼 가지는지 비교.
     *
     * @param left 왼쪽 목록 (null 허용)
     * @param right 오른쪽 목록 (null 허용)
     * @return 다중집합으로 같으면 true
     */
    public static boolean multisetEqual(List<?> left, List<?> right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null || left.size() != right.size()) {
            return false;
        }
        List<Object> remaining = new ArrayList<>(right);
        for (Object element : left) {
            int match = indexOf(remaining, element);
            if (match < 0) {
                return false;
            }
            remaining.remove(match);
        }
        return true;
    }

    private static int indexOf(List<Object> candidates, Object element) {
        for (int i = 0; i < candidates.size(); i++) {
            if (equal(element, candidates.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean mapsEqual(Map<?, ?> left, Map<?, ?> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (Map.Entry<?, ?> entry : left.entrySet()) {
            if (!right.containsKey(entry.getKey())) {
                return false;
            }
            if (!equal(entry.getValue(), right.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean listsEqual(List<?> left, List<?> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!equal(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean numbersEqual(Number left, Number right) {
        try {
            return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString())) == 0;
        } catch (NumberFormatException e) {
            // NaN, Infinity
            return Double.compare(left.doubleValue(), right.doubleValue()) == 0;
        }
    }
}
