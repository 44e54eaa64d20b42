package com.ryuqq.orderevents.core.exception;

/**
 * 현재 상태에서 허용되지 않는 상태 전이 (예: 종료 상태 FULFILLED에서 PACKAGED로). 재시도하지 않습니다.
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class InvalidTransitionException extends OrderEventException {

    public static final String ERROR_CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(String message) {
        super(ERROR_CODE, message, false);
    }

    public InvalidTransitionException(String message, Throwable cause) {
        super(ERROR_CODE, message, false, cause);
    }
}
