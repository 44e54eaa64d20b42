package com.ryuqq.orderevents.core.outcome;

/**
 * 영구적 실패 (재전달 불가).
 *
 * <p>재전달해도 입력이 바뀌지 않아 성공할 수 없는 경우를 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>잘못된 봉투 (resources 누락, 두 건 이상)</li>
 *   <li>잘못된 detail (JSON 파싱 실패, products 누락)</li>
 *   <li>허용되지 않는 상태 전이</li>
 * </ul>
 *
 * @param errorCode 오류 코드 (예: MALFORMED_EVENT)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements HandlingOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }
}
