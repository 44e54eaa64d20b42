package com.ryuqq.orderevents.core.contract;

import com.ryuqq.orderevents.core.model.Product;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 정규화된 이벤트 페이로드 (detail).
 *
 * <p>창고/배송 이벤트의 detail은 주문 스냅샷 전체 또는 일부입니다.
 * 코어가 사용하는 값은 products뿐이며, 나머지 필드는 참고용으로 보관됩니다.</p>
 *
 * @param products detail에 명시된 상품 목록 (detail에 products가 없으면 null)
 * @param fields detail의 최상위 필드 전체 (읽기 전용)
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record EventPayload(
    List<Product> products,
    Map<String, Object> fields
) {

    /**
     * Compact Constructor.
     */
    public EventPayload {
        products = products == null ? null : List.copyOf(products);
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * 빈 페이로드 생성 (지원하지 않는 detail-type처럼 detail을 해석하지 않은 경우).
     *
     * @return 빈 EventPayload
     */
    public static EventPayload empty() {
        return new EventPayload(null, Map.of());
    }

    /**
     * detail에 products가 포함되어 있는지 확인.
     *
     * @return products가 있으면 true
     */
    public boolean hasProducts() {
        return products != null;
    }
}
