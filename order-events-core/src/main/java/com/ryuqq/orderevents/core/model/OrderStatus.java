package com.ryuqq.orderevents.core.model;

/**
 * 주문의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ├─► PACKAGED ──────────┬─► FULFILLED (종료)
 *    │                      └─► DELIVERY_FAILED
 *    └─► PACKAGING_FAILED
 *
 * 비종료 상태 사이의 전이는 순서에 관계없이 허용 (이벤트 순서 보장 없음)
 * FULFILLED → * ❌ (동일 상태 재전달만 멱등 처리)
 * </pre>
 *
 * <p>상태 변경은 오직 {@code OrderTransitionEngine}만 수행합니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public enum OrderStatus {

    /**
     * 주문 생성됨 (외부에서 생성, 이 서비스의 범위 밖).
     */
    CREATED,

    /**
     * 창고에서 포장 완료.
     */
    PACKAGED,

    /**
     * 창고 포장 실패.
     */
    PACKAGING_FAILED,

    /**
     * 배송 완료.
     */
    FULFILLED,

    /**
     * 배송 실패.
     */
    DELIVERY_FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(FULFILLED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return FULFILLED인 경우 true
     */
    public boolean isTerminal() {
        return this == FULFILLED;
    }
}
