package com.ryuqq.orderevents.core.exception;

/**
 * 이벤트 처리 중 발생하는 모든 예외의 상위 타입.
 *
 * <p>각 예외는 오류 코드와 재시도 가능 여부를 가지며,
 * Event Handler는 이 두 값으로 {@code Retry} 또는 {@code Fail} 결과를 결정합니다.</p>
 *
 * <ul>
 *   <li>재시도 불가: 재전달해도 입력이 바뀌지 않는 경우 (잘못된 봉투, 잘못된 페이로드 등)</li>
 *   <li>재시도 가능: 일시적 장애 (저장소 쓰기 실패, 발행 실패, 동시 갱신 충돌)</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public abstract class OrderEventException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    protected OrderEventException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    protected OrderEventException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: MALFORMED_EVENT)
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 재전달 시 성공 가능성이 있는지 확인.
     *
     * @return 재시도 가능하면 true
     */
    public boolean isRetryable() {
        return retryable;
    }
}
