package com.ryuqq.orderevents.core.exception;

/**
 * 조건부 쓰기 충돌 (읽은 뒤 다른 처리기가 같은 주문을 먼저 갱신함). 재전달 시 최신 상태에서 다시 계산합니다.
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class ConcurrentUpdateException extends OrderEventException {

    public static final String ERROR_CODE = "CONCURRENT_UPDATE";

    public ConcurrentUpdateException(String message) {
        super(ERROR_CODE, message, true);
    }

    public ConcurrentUpdateException(String message, Throwable cause) {
        super(ERROR_CODE, message, true, cause);
    }
}
