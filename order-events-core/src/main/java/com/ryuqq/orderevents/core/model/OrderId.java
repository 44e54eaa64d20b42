package com.ryuqq.orderevents.core.model;

/**
 * 주문의 전역 고유 식별자.
 *
 * <p>OrderId는 Order Store의 기본 키이며, 인바운드 이벤트의 {@code resources}와
 * 아웃바운드 OrderModified 이벤트의 {@code resources}에 그대로 실립니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 (주문 생성 이후 orderId는 바뀌지 않음)</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자 포함 불가</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public final class OrderId {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private OrderId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OrderId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("OrderId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^\\S+$")) {
            throw new IllegalArgumentException("OrderId cannot contain whitespace");
        }
        this.value = value;
    }

    /**
     * OrderId 생성.
     *
     * @param value OrderId 값
     * @return OrderId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OrderId of(String value) {
        return new OrderId(value);
    }

    /**
     * OrderId 값 조회.
     *
     * @return OrderId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderId orderId = (OrderId) o;
        return value.equals(orderId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OrderId{" + value + '}';
    }
}
