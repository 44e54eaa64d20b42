package com.ryuqq.orderevents.core.exception;

/**
 * OrderModified 발행 실패. 저장은 이미 끝났으므로 재전달로 발행을 재시도해야 합니다.
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class PublishException extends OrderEventException {

    public static final String ERROR_CODE = "PUBLISH_FAILED";

    public PublishException(String message) {
        super(ERROR_CODE, message, true);
    }

    public PublishException(String message, Throwable cause) {
        super(ERROR_CODE, message, true, cause);
    }
}
