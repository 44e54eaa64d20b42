package com.ryuqq.orderevents.core.outcome;

/**
 * 인바운드 이벤트 하나의 처리 결과.
 *
 * <p>HandlingOutcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Processed}: 처리 완료 (변경 없음 포함)</li>
 *   <li>{@link Ignored}: 지원하지 않는 이벤트, 의도적으로 무시</li>
 *   <li>{@link Retry}: 일시적 실패, 재전달 필요</li>
 *   <li>{@link Fail}: 영구적 실패, 재전달해도 성공 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 호출 런타임이 모든 케이스를 처리하도록 강제합니다.</p>
 *
 * <p><strong>호출 런타임 처리 예시:</strong></p>
 * <pre>
 * if (outcome.isRetry()) {
 *     queue.nack(delivery, backoff);      // 재전달
 * } else if (outcome.isFail()) {
 *     queue.deadLetter(delivery, reason); // 로그 후 폐기
 * } else {
 *     queue.ack(delivery);                // Processed, Ignored
 * }
 * </pre>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public sealed interface HandlingOutcome permits Processed, Ignored, Retry, Fail {

    /**
     * 처리 완료 여부.
     *
     * @return Processed인 경우 true
     */
    default boolean isProcessed() {
        return this instanceof Processed;
    }

    /**
     * 무시된 이벤트 여부.
     *
     * @return Ignored인 경우 true
     */
    default boolean isIgnored() {
        return this instanceof Ignored;
    }

    /**
     * 재전달이 필요한지 확인.
     *
     * @return Retry인 경우 true
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 영구 실패 여부.
     *
     * @return Fail인 경우 true
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
