package com.ryuqq.orderevents.core.exception;

import com.ryuqq.orderevents.core.model.OrderId;

/**
 * 이벤트가 참조하는 주문이 Order Store에 없음.
 *
 * <p>주문 생성이 아직 반영되지 않았을 수 있는 환경(최종 일관성)에서는 재시도 가능,
 * 그렇지 않으면 재시도 불가입니다. 어느 쪽인지는 호출자가 설정으로 결정합니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class OrderNotFoundException extends OrderEventException {

    public static final String ERROR_CODE = "ORDER_NOT_FOUND";

    private final OrderId orderId;

    public OrderNotFoundException(OrderId orderId, boolean retryable) {
        super(ERROR_CODE, "Order not found: " + (orderId == null ? null : orderId.getValue()), retryable);
        this.orderId = orderId;
    }

    public OrderId getOrderId() {
        return orderId;
    }
}
