package com.ryuqq.orderevents.core.exception;

/**
 * detail 파싱 실패 또는 detail-type에 맞지 않는 페이로드 형태. 재시도하지 않습니다.
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class InvalidPayloadException extends OrderEventException {

    public static final String ERROR_CODE = "INVALID_PAYLOAD";

    public InvalidPayloadException(String message) {
        super(ERROR_CODE, message, false);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(ERROR_CODE, message, false, cause);
    }
}
