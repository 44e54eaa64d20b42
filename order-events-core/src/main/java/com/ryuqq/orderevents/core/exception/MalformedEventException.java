package com.ryuqq.orderevents.core.exception;

/**
 * 봉투 형태가 잘못된 이벤트 (resources가 정확히 한 건이 아니거나 detail-type이 없는 경우 등). 재전달로 고칠 수 없으므로 재시도하지 않습니다.
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class MalformedEventException extends OrderEventException {

    public static final String ERROR_CODE = "MALFORMED_EVENT";

    public MalformedEventException(String message) {
        super(ERROR_CODE, message, false);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(ERROR_CODE, message, false, cause);
    }
}
