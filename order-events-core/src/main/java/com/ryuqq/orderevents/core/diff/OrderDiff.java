package com.ryuqq.orderevents.core.diff;

import com.ryuqq.orderevents.core.model.Order;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 두 주문 상태 사이의 최상위 필드 변경 계산.
 *
 * <p>변경 필드는 전이 분기마다 수동으로 추적하지 않고 이전/이후 상태에서 구조적으로 도출합니다.
 * 따라서 상태와 상품 내용이 함께 바뀌어도 둘 다 감지됩니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>비교 대상: 두 주문의 필드 맵 키 합집합</li>
 *   <li>한쪽에만 있는 필드는 변경</li>
 *   <li>products는 다중집합으로 비교 (순서만 바뀐 경우 변경 아님)</li>
 *   <li>나머지 필드는 {@link StructuralEquality#equal(Object, Object)}로 비교</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public final class OrderDiff {

    // Utility class - prevent instantiation
    private OrderDiff() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 변경된 최상위 필드 이름 계산.
     *
     * @param before 변경 전 주문
     * @param after 변경 후 주문
     * @return 변경된 필드 이름 (이름순, 읽기 전용, 변경 없으면 빈 집합)
     * @throws IllegalArgumentException 주문이 null이거나 서로 다른 주문인 경우
     */
    public static Set<String> changedFields(Order before, Order after) {
        if (before == null || after == null) {
            throw new IllegalArgumentException("Orders cannot be null (before: " + before + ", after: " + after + ")");
        }
        if (!before.orderId().equals(after.orderId())) {
            throw new IllegalArgumentException(
                String.format("Cannot diff different orders: %s → %s", before.orderId(), after.orderId())
            );
        }

        Map<String, Object> oldFields = before.toFieldMap();
        Map<String, Object> newFields = after.toFieldMap();

        Set<String> names = new TreeSet<>(oldFields.keySet());
        names.addAll(newFields.keySet());

        Set<String> changed = new TreeSet<>();
        for (String name : names) {
            if (oldFields.containsKey(name) != newFields.containsKey(name)) {
                changed.add(name);
            } else if (!fieldEqual(name, oldFields.get(name), newFields.get(name))) {
                changed.add(name);
            }
        }
        return Collections.unmodifiableSet(changed);
    }

    private static boolean fieldEqual(String name, Object before, Object after) {
        if (Order.PRODUCTS.equals(name) && before instanceof List<?> l && after instanceof List<?> r) {
            return StructuralEquality.multisetEqual(l, r);
        }
        return StructuralEquality.equal(before, after);
    }
}
