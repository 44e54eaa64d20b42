package com.ryuqq.orderevents.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Order Store에 저장되는 주문 Aggregate.
 *
 * <p>코어가 해석하는 필드는 {@code orderId}, {@code status}, {@code products} 세 가지뿐이며,
 * 고객/가격/주소 등 나머지 최상위 필드는 {@code attributes}에 담겨 변경 없이 통과합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>orderId는 생성 후 변경 불가</li>
 *   <li>products 내 productId는 중복 불가</li>
 *   <li>attributes는 예약 필드 이름(orderId, status, products)을 사용할 수 없음</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Order order = new Order(
 *     OrderId.of("O1"),
 *     OrderStatus.CREATED,
 *     List.of(Product.of("P1"), Product.of("P2")),
 *     Map.of("userId", "U1")
 * );
 * Order packaged = order.withStatus(OrderStatus.PACKAGED);
 * </pre>
 *
 * @param orderId 주문 식별자
 * @param status 주문 상태
 * @param products 상품 라인 (순서 유지, 읽기 전용)
 * @param attributes 코어가 해석하지 않는 나머지 최상위 필드 (중첩 값까지 읽기 전용)
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record Order(
    OrderId orderId,
    OrderStatus status,
    List<Product> products,
    Map<String, Object> attributes
) {

    public static final String ORDER_ID = "orderId";
    public static final String STATUS = "status";
    public static final String PRODUCTS = "products";

    private static final Set<String> RESERVED_FIELDS = Set.of(ORDER_ID, STATUS, PRODUCTS);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 불변식을 위반한 경우
     */
    public Order {
        if (orderId == null) {
            throw new IllegalArgumentException("orderId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        products = products == null ? List.of() : List.copyOf(products);
        Set<String> seen = new HashSet<>();
        for (Product product : products) {
            if (!seen.add(product.productId())) {
                throw new IllegalArgumentException("duplicate productId in order " + orderId.getValue() + ": " + product.productId());
            }
        }
        if (attributes == null) {
            attributes = Map.of();
        } else {
            for (String key : attributes.keySet()) {
                if (RESERVED_FIELDS.contains(key)) {
                    throw new IllegalArgumentException("attributes cannot contain reserved key: " + key);
                }
            }
            attributes = JsonValues.immutableCopy(attributes);
        }
    }

    /**
     * 상태만 변경한 새 인스턴스 생성.
     *
     * @param status 새 상태
     * @return 새 Order 인스턴스
     */
    public Order withStatus(OrderStatus status) {
        return new Order(orderId, status, products, attributes);
    }

    /**
     * 상품 목록만 변경한 새 인스턴스 생성.
     *
     * @param products 새 상품 목록
     * @return 새 Order 인스턴스
     */
    public Order withProducts(List<Product> products) {
        return new Order(orderId, status, products, attributes);
    }

    /**
     * attribute 하나를 설정한 새 인스턴스 생성.
     *
     * @param key attribute 이름 (예약 필드 불가)
     * @param value attribute 값 (null 허용)
     * @return 새 Order 인스턴스
     */
    public Order withAttribute(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new Order(orderId, status, products, copy);
    }

    /**
     * 상품 식별자 목록 조회 (저장 순서).
     *
     * @return productId 목록
     */
    public List<String> productIds() {
        List<String> ids = new ArrayList<>(products.size());
        for (Product product : products) {
            ids.add(product.productId());
        }
        return ids;
    }

    /**
     * JSON 형태의 최상위 필드 맵으로 변환.
     *
     * <p>키 순서: orderId, status, products, 이후 attributes 입력 순서.</p>
     *
     * @return 필드 맵 (최상위만 수정 가능, 중첩 값은 읽기 전용)
     */
    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ORDER_ID, orderId.getValue());
        fields.put(STATUS, status.name());
        List<Map<String, Object>> productFields = new ArrayList<>(products.size());
        for (Product product : products) {
            productFields.add(product.toFieldMap());
        }
        fields.put(PRODUCTS, productFields);
        fields.putAll(attributes);
        return fields;
    }

    /**
     * JSON 형태의 최상위 필드 맵에서 Order 생성.
     *
     * @param fields orderId, status를 포함한 필드 맵 (products는 선택)
     * @return Order 인스턴스
     * @throws IllegalArgumentException 필드 형태가 올바르지 않은 경우
     */
    public static Order fromFieldMap(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        Object id = fields.get(ORDER_ID);
        if (!(id instanceof String)) {
            throw new IllegalArgumentException("order requires a textual orderId (current: " + id + ")");
        }
        Object status = fields.get(STATUS);
        if (!(status instanceof String)) {
            throw new IllegalArgumentException("order requires a textual status (current: " + status + ")");
        }

        List<Product> products = new ArrayList<>();
        Object rawProducts = fields.get(PRODUCTS);
        if (rawProducts != null) {
            if (!(rawProducts instanceof List<?> list)) {
                throw new IllegalArgumentException("products must be a list");
            }
            for (Object element : list) {
                if (!(element instanceof Map<?, ?> map)) {
                    throw new IllegalArgumentException("product must be an object (current: " + element + ")");
                }
                products.add(Product.fromFieldMap(stringKeys(map)));
            }
        }

        Map<String, Object> attributes = new LinkedHashMap<>(fields);
        attributes.remove(ORDER_ID);
        attributes.remove(STATUS);
        attributes.remove(PRODUCTS);

        return new Order(OrderId.of((String) id), OrderStatus.valueOf((String) status), products, attributes);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }
}
