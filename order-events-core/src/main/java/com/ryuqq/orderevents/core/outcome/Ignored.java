package com.ryuqq.orderevents.core.outcome;

/**
 * 무시된 이벤트.
 *
 * <p>처리 대상이 아닌 detail-type이거나 기대 발행 주체와 다른 이벤트입니다.
 * 오류가 아니므로 재전달하지 않습니다.</p>
 *
 * @param detailType 이벤트 유형 (null 가능)
 * @param reason 무시 사유
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record Ignored(
    String detailType,
    String reason
) implements HandlingOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null이거나 빈 문자열인 경우
     */
    public Ignored {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
