package com.ryuqq.orderevents.core.contract;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 이벤트 버스를 통해 전달된 인바운드 도메인 이벤트 (봉투 원형).
 *
 * <p>창고(ecommerce.warehouse)나 배송(ecommerce.delivery) 서브시스템이 발행한 이벤트를
 * 파싱 전 형태 그대로 담습니다. 형태 검증은 {@code EventNormalizer}의 책임이므로
 * 이 record는 어떤 값도 거부하지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>source:</strong> 발행 주체 (예: ecommerce.warehouse)</li>
 *   <li><strong>detailType:</strong> 이벤트 유형 (예: PackageCreated)</li>
 *   <li><strong>resources:</strong> 대상 리소스 목록 (orderId 하나를 포함해야 함)</li>
 *   <li><strong>detail:</strong> JSON 문자열 페이로드 (주문 스냅샷 전체 또는 일부)</li>
 *   <li><strong>eventBusName:</strong> 이벤트 버스 이름 (null 가능)</li>
 *   <li><strong>time:</strong> 발행 시각 (null 가능)</li>
 * </ul>
 *
 * @param source 발행 주체
 * @param detailType 이벤트 유형
 * @param resources 대상 리소스 목록
 * @param detail JSON 페이로드
 * @param eventBusName 이벤트 버스 이름
 * @param time 발행 시각
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public record DomainEvent(
    String source,
    String detailType,
    List<String> resources,
    String detail,
    String eventBusName,
    Instant time
) {

    /**
     * Compact Constructor.
     *
     * <p>resources는 null 원소를 허용하는 읽기 전용 복사본으로 보관합니다.</p>
     */
    public DomainEvent {
        if (resources != null) {
            resources = Collections.unmodifiableList(new ArrayList<>(resources));
        }
    }

    /**
     * 주문 하나를 대상으로 하는 이벤트 생성 (현재 시각, 버스 이름 없음).
     *
     * @param source 발행 주체
     * @param detailType 이벤트 유형
     * @param orderId 대상 주문 식별자
     * @param detail JSON 페이로드
     * @return DomainEvent 인스턴스
     */
    public static DomainEvent of(String source, String detailType, String orderId, String detail) {
        return new DomainEvent(source, detailType, List.of(orderId), detail, null, Instant.now());
    }
}
