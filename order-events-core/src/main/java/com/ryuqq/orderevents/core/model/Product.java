package com.ryuqq.orderevents.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 주문에 포함된 상품 라인.
 *
 * <p>productId 외의 값(name, price, quantity 등)은 코어가 해석하지 않는 메타데이터로
 * {@code attributes}에 그대로 보관됩니다.</p>
 *
 * @param productId 상품 식별자 (주문 내 고유)
 * @param attributes 상품 메타데이터 (중첩 값까지 읽기 전용, 입력 순서 유지)
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record Product(
    String productId,
    Map<String, Object> attributes
) {

    /**
     * 상품 식별자 필드 이름.
     */
    public static final String PRODUCT_ID = "productId";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException productId가 null이거나 빈 문자열인 경우,
     *                                  attributes에 productId 키가 포함된 경우
     */
    public Product {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be null or blank");
        }
        if (attributes == null) {
            attributes = Map.of();
        } else {
            if (attributes.containsKey(PRODUCT_ID)) {
                throw new IllegalArgumentException("attributes cannot contain reserved key: " + PRODUCT_ID);
            }
            attributes = JsonValues.immutableCopy(attributes);
        }
    }

    /**
     * 메타데이터 없이 Product 생성.
     *
     * @param productId 상품 식별자
     * @return Product 인스턴스
     */
    public static Product of(String productId) {
        return new Product(productId, Map.of());
    }

    /**
     * JSON 형태의 필드 맵에서 Product 생성.
     *
     * @param fields productId를 포함한 필드 맵
     * @return Product 인스턴스
     * @throws IllegalArgumentException productId가 없거나 문자열이 아닌 경우
     */
    public static Product fromFieldMap(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        Object id = fields.get(PRODUCT_ID);
        if (!(id instanceof String)) {
            throw new IllegalArgumentException("product requires a textual productId (current: " + id + ")");
        }
        Map<String, Object> attributes = new LinkedHashMap<>(fields);
        attributes.remove(PRODUCT_ID);
        return new Product((String) id, attributes);
    }

    /**
     * JSON 형태의 필드 맵으로 변환 (productId가 첫 번째 키).
     *
     * @return 필드 맵
     */
    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(PRODUCT_ID, productId);
        fields.putAll(attributes);
        return fields;
    }
}
