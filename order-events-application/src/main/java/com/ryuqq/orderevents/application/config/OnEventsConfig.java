package com.ryuqq.orderevents.application.config;

import com.ryuqq.orderevents.core.spi.ConfigProvider;

/**
 * OnEventsHandler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>source: 발행하는 변경 이벤트의 source (기본 ecommerce.orders)</li>
 *   <li>eventBusName: 변경 이벤트를 발행할 버스 이름 (null 허용)</li>
 *   <li>tableName: 주문 테이블 이름 (null 허용)</li>
 *   <li>publishNoOpChanges: 변경 없는 전이에도 빈 변경 이벤트 발행 여부 (기본 false)</li>
 *   <li>retryMissingOrders: 주문을 찾지 못한 경우 재시도 여부 (기본 true, 주문 생성이 아직 진행 중일 수 있음)</li>
 * </ul>
 *
 * <p><strong>파라미터 이름:</strong></p>
 * <ul>
 *   <li>{@value #TABLE_NAME_PARAMETER} (필수)</li>
 *   <li>{@value #EVENT_BUS_NAME_PARAMETER} (필수)</li>
 *   <li>{@value #PUBLISH_NO_OP_PARAMETER} (선택)</li>
 *   <li>{@value #RETRY_MISSING_PARAMETER} (선택)</li>
 * </ul>
 *
 * @author Order Events Team
 * @since 1.0.0
 * @param source 변경 이벤트 source (빈 문자열 불가)
 * @param eventBusName 이벤트 버스 이름
 * @param tableName 주문 테이블 이름
 * @param publishNoOpChanges 변경 없는 전이 발행 여부
 * @param retryMissingOrders 없는 주문 재시도 여부
 */
public record OnEventsConfig(
    String source,
    String eventBusName,
    String tableName,
    boolean publishNoOpChanges,
    boolean retryMissingOrders
) {

    public static final String DEFAULT_SOURCE = "ecommerce.orders";

    public static final String TABLE_NAME_PARAMETER = "/ecommerce/{Environment}/orders/table/name";
    public static final String EVENT_BUS_NAME_PARAMETER = "/ecommerce/{Environment}/platform/event-bus/name";
    public static final String PUBLISH_NO_OP_PARAMETER = "/ecommerce/{Environment}/orders/on-events/publish-no-op-changes";
    public static final String RETRY_MISSING_PARAMETER = "/ecommerce/{Environment}/orders/on-events/retry-missing-orders";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: source=ecommerce.orders, eventBusName=null, tableName=null,
     * publishNoOpChanges=false, retryMissingOrders=true</p>
     */
    public OnEventsConfig() {
        this(DEFAULT_SOURCE, null, null, false, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException source가 null이거나 빈 문자열인 경우
     */
    public OnEventsConfig {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank (current: " + source + ")");
        }
    }

    /**
     * 파라미터 저장소에서 설정 로드.
     *
     * @param provider 파라미터 저장소
     * @return 로드된 설정
     * @throws IllegalArgumentException provider가 null이거나 플래그 값이 true/false가 아닌 경우
     * @throws IllegalStateException 필수 파라미터가 없는 경우
     */
    public static OnEventsConfig load(ConfigProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        OnEventsConfig defaults = new OnEventsConfig();
        String tableName = required(provider, TABLE_NAME_PARAMETER);
        String eventBusName = required(provider, EVENT_BUS_NAME_PARAMETER);
        boolean publishNoOp = provider.get(PUBLISH_NO_OP_PARAMETER)
            .map(value -> parseFlag(PUBLISH_NO_OP_PARAMETER, value))
            .orElse(defaults.publishNoOpChanges());
        boolean retryMissing = provider.get(RETRY_MISSING_PARAMETER)
            .map(value -> parseFlag(RETRY_MISSING_PARAMETER, value))
            .orElse(defaults.retryMissingOrders());
        return new OnEventsConfig(defaults.source(), eventBusName, tableName, publishNoOp, retryMissing);
    }

    private static String required(ConfigProvider provider, String name) {
        return provider.get(name)
            .filter(value -> !value.isBlank())
            .orElseThrow(() -> new IllegalStateException("Missing configuration parameter: " + name));
    }

    private static boolean parseFlag(String name, String value) {
        String normalized = value.trim().toLowerCase();
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be true or false (current: " + value + ")");
    }

    /**
     * source만 변경한 새 인스턴스 생성.
     */
    public OnEventsConfig withSource(String source) {
        return new OnEventsConfig(source, eventBusName, tableName, publishNoOpChanges, retryMissingOrders);
    }

    /**
     * eventBusName만 변경한 새 인스턴스 생성.
     */
    public OnEventsConfig withEventBusName(String eventBusName) {
        return new OnEventsConfig(source, eventBusName, tableName, publishNoOpChanges, retryMissingOrders);
    }

    /**
     * tableName만 변경한 새 인스턴스 생성.
     */
    public OnEventsConfig withTableName(String tableName) {
        return new OnEventsConfig(source, eventBusName, tableName, publishNoOpChanges, retryMissingOrders);
    }

    /**
     * publishNoOpChanges만 변경한 새 인스턴스 생성.
     */
    public OnEventsConfig withPublishNoOpChanges(boolean publishNoOpChanges) {
        return new OnEventsConfig(source, eventBusName, tableName, publishNoOpChanges, retryMissingOrders);
    }

    /**
     * retryMissingOrders만 변경한 새 인스턴스 생성.
     */
    public OnEventsConfig withRetryMissingOrders(boolean retryMissingOrders) {
        return new OnEventsConfig(source, eventBusName, tableName, publishNoOpChanges, retryMissingOrders);
    }
}
