package com.ryuqq.orderevents.core.exception;

/**
 * 이 서비스가 처리하지 않는 이벤트.
 *
 * <p>오류가 아니라 의도적으로 무시하는 이벤트 분류입니다. Event Handler는 이 예외를
 * {@code Ignored} 결과로 변환하며, 저장소 변경과 발행 모두 일어나지 않습니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class UnsupportedEventException extends OrderEventException {

    public static final String ERROR_CODE = "UNSUPPORTED_EVENT";

    private final String detailType;

    public UnsupportedEventException(String detailType, String message) {
        super(ERROR_CODE, message, false);
        this.detailType = detailType;
    }

    public String getDetailType() {
        return detailType;
    }
}
