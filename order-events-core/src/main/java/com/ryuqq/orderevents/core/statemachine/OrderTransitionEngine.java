package com.ryuqq.orderevents.core.statemachine;

import com.ryuqq.orderevents.core.contract.NormalizedEvent;
import com.ryuqq.orderevents.core.contract.OrderEventType;
import com.ryuqq.orderevents.core.diff.OrderDiff;
import com.ryuqq.orderevents.core.exception.InvalidPayloadException;
import com.ryuqq.orderevents.core.exception.UnsupportedEventException;
import com.ryuqq.orderevents.core.model.Order;
import com.ryuqq.orderevents.core.model.OrderStatus;
import com.ryuqq.orderevents.core.model.Product;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 정규화된 이벤트를 주문에 적용하는 상태 전이 엔진.
 *
 * <p>순수 계산만 수행하며 저장/발행은 호출자의 책임입니다. 같은 입력에는 같은 결과를 돌려주고
 * 자신의 결과에 다시 적용하면 변경이 없습니다.</p>
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>detail-type과 source로 {@link OrderEventType} 결정 (불일치 시 {@link UnsupportedEventException})</li>
 *   <li>{@link OrderStatusTransition#validate} 로 상태 규칙 검증</li>
 *   <li>PackageCreated: 저장된 상품 중 이벤트에 포함된 productId만 남김 (저장 순서/메타데이터 유지)</li>
 *   <li>{@link OrderDiff}로 변경 필드 도출</li>
 * </ol>
 *
 * <p>status와 products 외의 필드(modifiedDate 포함)는 그대로 유지되므로 changedFields는
 * previous와 updated의 구조적 차이와 항상 같습니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class OrderTransitionEngine {

    /**
     * 이벤트 적용.
     *
     * @param current 저장소에서 읽은 현재 주문
     * @param event 정규화된 이벤트
     * @return 전이 결과
     * @throws IllegalArgumentException 인자가 null이거나 이벤트 대상 주문이 다른 경우
     * @throws UnsupportedEventException 처리 대상이 아닌 detail-type이거나 source가 일치하지 않는 경우
     * @throws com.ryuqq.orderevents.core.exception.InvalidTransitionException 종료 상태 위반
     * @throws InvalidPayloadException PackageCreated에 products가 없는 경우
     */
    public TransitionResult apply(Order current, NormalizedEvent event) {
        if (current == null) {
            throw new IllegalArgumentException("current order cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!current.orderId().equals(event.orderId())) {
            throw new IllegalArgumentException(
                String.format("Event targets %s but order is %s", event.orderId(), current.orderId())
            );
        }

        OrderEventType type = resolve(event);
        OrderStatus next = OrderStatusTransition.transition(current.status(), type.targetStatus());

        Order updated = current.withStatus(next);
        if (type.productsRequired()) {
            if (!event.payload().hasProducts()) {
                throw new InvalidPayloadException(type.detailType() + " requires products");
            }
            updated = updated.withProducts(retain(current.products(), event.payload().products()));
        }

        Set<String> changed = OrderDiff.changedFields(current, updated);
        if (changed.isEmpty()) {
            return new TransitionResult(current, current, changed);
        }
        return new TransitionResult(current, updated, changed);
    }

    /**
     * 이 엔진이 처리하는 이벤트인지 확인 (detail-type과 source 모두 일치).
     *
     * @param event 정규화된 이벤트
     * @return 처리 대상이면 true
     * @throws IllegalArgumentException event가 null인 경우
     */
    public boolean supports(NormalizedEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return OrderEventType.fromDetailType(event.detailType())
            .map(type -> type.source().equals(event.source()))
            .orElse(false);
    }

    private OrderEventType resolve(NormalizedEvent event) {
        OrderEventType type = OrderEventType.fromDetailType(event.detailType())
            .orElseThrow(() -> new UnsupportedEventException(
                event.detailType(), "Unsupported detail-type: " + event.detailType()));
        if (!type.source().equals(event.source())) {
            throw new UnsupportedEventException(
                event.detailType(),
                String.format("%s must come from %s (current: %s)", type.detailType(), type.source(), event.source())
            );
        }
        return type;
    }

    private static List<Product> retain(List<Product> stored, List<Product> fromEvent) {
        Set<String> packaged = new HashSet<>();
        for (Product product : fromEvent) {
            packaged.add(product.productId());
        }
        List<Product> kept = new ArrayList<>();
        for (Product product : stored) {
            if (packaged.contains(product.productId())) {
                kept.add(product);
            }
        }
        return kept;
    }
}
