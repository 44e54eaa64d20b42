package com.ryuqq.orderevents.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON 형태 값(Map, List, 스칼라)의 읽기 전용 깊은 복사 유틸리티.
 *
 * <p>Order, Product, ChangeDetail은 중첩 객체(예: products[].package)를 그대로 보관하므로,
 * 최상위만 복사하면 발행된 이미지를 통해 저장된 주문이 바뀔 수 있습니다.
 * 이 유틸리티는 모든 깊이의 Map/List를 새로 복사해 수정 불가 구조로 감쌉니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>Map → 입력 순서를 유지하는 수정 불가 Map (키는 문자열로 변환)</li>
 *   <li>List → 수정 불가 List</li>
 *   <li>그 외 값(String, Number, Boolean, null) → 그대로 반환</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public final class JsonValues {

    private JsonValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 필드 맵을 깊은 복사해 수정 불가 Map으로 반환.
     *
     * @param fields 복사할 필드 맵 (null 값 허용)
     * @return 읽기 전용 복사본
     * @throws IllegalArgumentException fields가 null인 경우
     */
    public static Map<String, Object> immutableCopy(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        return copyMap(fields);
    }

    /**
     * 임의의 JSON 값을 깊은 복사.
     *
     * @param value 복사할 값
     * @return Map/List는 읽기 전용 복사본, 그 외는 원래 값
     */
    public static Object immutableCopyOf(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(immutableCopyOf(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Map<String, Object> copyMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), immutableCopyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
