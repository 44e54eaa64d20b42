package com.ryuqq.orderevents.core.contract;

import com.ryuqq.orderevents.core.model.OrderId;

import java.time.Instant;
import java.util.List;

/**
 * 아웃바운드 OrderModified 이벤트.
 *
 * <p>처리된 인바운드 이벤트 하나당 최대 하나가 발행되며, 다운스트림 소비자에게
 * 주문 상태 변경을 정규화된 형태로 알립니다.</p>
 *
 * <p><strong>와이어 형태:</strong></p>
 * <pre>
 * {
 *   "id": "...",
 *   "source": "ecommerce.orders",
 *   "detail-type": "OrderModified",
 *   "resources": ["O1"],
 *   "detail": {"changed": ["products", "status"], "old": {...}, "new": {...}}
 * }
 * </pre>
 *
 * @param eventId 변경 식별자 (미발행 변경 로그의 키)
 * @param source 발행 주체
 * @param detailType 항상 OrderModified
 * @param resources 대상 주문 식별자 하나
 * @param detail 변경 내역
 * @param eventBusName 이벤트 버스 이름 (null 가능)
 * @param time 변경 시각
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record ChangeEvent(
    String eventId,
    String source,
    String detailType,
    List<String> resources,
    ChangeDetail detail,
    String eventBusName,
    Instant time
) {

    /**
     * 주문 변경 이벤트의 detail-type.
     */
    public static final String ORDER_MODIFIED = "OrderModified";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 resources가 한 건이 아닌 경우
     */
    public ChangeEvent {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId cannot be null or blank");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        if (detailType == null || detailType.isBlank()) {
            throw new IllegalArgumentException("detailType cannot be null or blank");
        }
        if (resources == null || resources.size() != 1) {
            throw new IllegalArgumentException("resources must contain exactly one orderId (current: " + resources + ")");
        }
        if (detail == null) {
            throw new IllegalArgumentException("detail cannot be null");
        }
        if (time == null) {
            throw new IllegalArgumentException("time cannot be null");
        }
        resources = List.copyOf(resources);
    }

    /**
     * OrderModified 이벤트 생성.
     *
     * @param eventId 변경 식별자
     * @param source 발행 주체
     * @param orderId 대상 주문
     * @param detail 변경 내역
     * @param eventBusName 이벤트 버스 이름
     * @param time 변경 시각
     * @return ChangeEvent 인스턴스
     */
    public static ChangeEvent orderModified(
        String eventId,
        String source,
        OrderId orderId,
        ChangeDetail detail,
        String eventBusName,
        Instant time
    ) {
        return new ChangeEvent(eventId, source, ORDER_MODIFIED, List.of(orderId.getValue()), detail, eventBusName, time);
    }

    /**
     * 대상 주문 식별자 조회.
     *
     * @return resources의 유일한 원소
     */
    public OrderId orderId() {
        return OrderId.of(resources.get(0));
    }

    /**
     * 변경 필드가 없는 이벤트인지 확인.
     *
     * @return changed가 비어 있으면 true
     */
    public boolean isEmpty() {
        return detail.changed().isEmpty();
    }
}
