package com.ryuqq.orderevents.core.outcome;

/**
 * 재전달이 필요한 일시적 실패.
 *
 * <p>핸들러는 내부에서 재시도하지 않습니다. 재전달 시점과 횟수는 호출 런타임
 * (이벤트 전달 협력자)이 결정하며, 핸들러 로직의 멱등성이 재전달을 안전하게 만듭니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Order Store 쓰기 실패</li>
 *   <li>저장 후 OrderModified 발행 실패</li>
 *   <li>조건부 쓰기 충돌</li>
 * </ul>
 *
 * @param errorCode 오류 코드
 * @param reason 재시도 사유
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record Retry(
    String errorCode,
    String reason
) implements HandlingOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 reason이 null이거나 빈 문자열인 경우
     */
    public Retry {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
