package com.ryuqq.orderevents.core.contract;

import com.ryuqq.orderevents.core.model.OrderId;

/**
 * 정규화된 인바운드 이벤트 ({@code (eventType, orderId, payload)} 삼중항).
 *
 * <p>{@code EventNormalizer}가 봉투 형태를 검증한 뒤 생성합니다.
 * detailType은 아직 해석되지 않은 문자열이며, 지원 여부는 Transition Engine이 판단합니다.</p>
 *
 * @param source 발행 주체
 * @param detailType 이벤트 유형 문자열
 * @param orderId 대상 주문 식별자 (resources의 유일한 원소)
 * @param payload 정규화된 detail
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record NormalizedEvent(
    String source,
    String detailType,
    OrderId orderId,
    EventPayload payload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public NormalizedEvent {
        if (detailType == null || detailType.isBlank()) {
            throw new IllegalArgumentException("detailType cannot be null or blank");
        }
        if (orderId == null) {
            throw new IllegalArgumentException("orderId cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        // source는 null 허용 (Transition Engine이 불일치로 판단)
    }
}
