package com.ryuqq.orderevents.core.exception;

/**
 * Order Store 읽기/쓰기 실패. 일시적 장애로 간주하여 재전달을 요청합니다.
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class StoreException extends OrderEventException {

    public static final String ERROR_CODE = "STORE_WRITE_FAILED";

    public StoreException(String message) {
        super(ERROR_CODE, message, true);
    }

    public StoreException(String message, Throwable cause) {
        super(ERROR_CODE, message, true, cause);
    }
}
