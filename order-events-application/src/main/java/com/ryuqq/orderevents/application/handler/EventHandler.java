package com.ryuqq.orderevents.application.handler;

import com.ryuqq.orderevents.core.contract.DomainEvent;
import com.ryuqq.orderevents.core.outcome.HandlingOutcome;

/**
 * 인바운드 이벤트 하나를 처리하는 진입점.
 *
 * <p>구현체는 예외를 던지지 않고 결과를 {@link HandlingOutcome}으로 돌려줍니다.
 * 재전달 여부는 호출하는 런타임이 결과에 따라 결정합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * HandlingOutcome outcome = handler.handle(event);
 * if (outcome.isRetry()) {
 *     queue.nack(delivery, backoffMs);
 * } else {
 *     queue.ack(delivery);
 * }
 * </pre>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public interface EventHandler {

    /**
     * 도메인 이벤트 처리.
     *
     * @param event 인바운드 이벤트
     * @return 처리 결과 (Processed, Ignored, Retry, Fail 중 하나)
     */
    HandlingOutcome handle(DomainEvent event);

    /**
     * JSON 봉투 처리.
     *
     * @param rawEnvelope 봉투 JSON (전달 형식 또는 PutEvents 항목 형식)
     * @return 처리 결과
     */
    HandlingOutcome handle(String rawEnvelope);
}
