package com.ryuqq.orderevents.core.statemachine;

import com.ryuqq.orderevents.core.exception.InvalidTransitionException;
import com.ryuqq.orderevents.core.model.OrderStatus;

/**
 * 주문 상태 전이 검증.
 *
 * <p>창고/배송 이벤트는 순서 보장 없이 도착하므로 비종료 상태 사이의 전이는 순서를 따지지 않고
 * 저장된 상태 위에 그대로 적용합니다. 종료 상태만 보호합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>비종료 상태 → 임의의 상태</li>
 *   <li>FULFILLED → FULFILLED (재전달, 멱등)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>FULFILLED에서 다른 상태로 전이 불가</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public final class OrderStatusTransition {

    // Utility class - prevent instantiation
    private OrderStatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidTransitionException 종료 상태에서 다른 상태로 전이하려는 경우
     */
    public static void validate(OrderStatus from, OrderStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal() && from != to) {
            throw new InvalidTransitionException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws InvalidTransitionException 유효하지 않은 전이인 경우
     */
    public static OrderStatus transition(OrderStatus current, OrderStatus next) {
        validate(current, next);
        return next;
    }
}
