package com.ryuqq.orderevents.core.contract;

import com.ryuqq.orderevents.core.model.OrderStatus;

import java.util.Optional;

/**
 * 이 서비스가 처리하는 인바운드 이벤트 유형.
 *
 * <p>각 유형은 detail-type 문자열, 기대 발행 주체(source), 전이 대상 상태를 가집니다.
 * 목록에 없는 detail-type(예: OrderCreated)은 다른 협력자의 관심사이며 무시됩니다.</p>
 *
 * <table>
 *   <caption>이벤트 유형</caption>
 *   <tr><th>detail-type</th><th>source</th><th>대상 상태</th></tr>
 *   <tr><td>PackageCreated</td><td>ecommerce.warehouse</td><td>PACKAGED</td></tr>
 *   <tr><td>PackagingFailed</td><td>ecommerce.warehouse</td><td>PACKAGING_FAILED</td></tr>
 *   <tr><td>DeliveryCompleted</td><td>ecommerce.delivery</td><td>FULFILLED</td></tr>
 *   <tr><td>DeliveryFailed</td><td>ecommerce.delivery</td><td>DELIVERY_FAILED</td></tr>
 * </table>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public enum OrderEventType {

    PACKAGE_CREATED("PackageCreated", "ecommerce.warehouse", OrderStatus.PACKAGED, true),
    PACKAGING_FAILED("PackagingFailed", "ecommerce.warehouse", OrderStatus.PACKAGING_FAILED, false),
    DELIVERY_COMPLETED("DeliveryCompleted", "ecommerce.delivery", OrderStatus.FULFILLED, false),
    DELIVERY_FAILED("DeliveryFailed", "ecommerce.delivery", OrderStatus.DELIVERY_FAILED, false);

    private final String detailType;
    private final String source;
    private final OrderStatus targetStatus;
    private final boolean productsRequired;

    OrderEventType(String detailType, String source, OrderStatus targetStatus, boolean productsRequired) {
        this.detailType = detailType;
        this.source = source;
        this.targetStatus = targetStatus;
        this.productsRequired = productsRequired;
    }

    /**
     * detail-type 문자열로 유형 조회.
     *
     * @param detailType detail-type (예: PackageCreated)
     * @return 일치하는 유형, 없으면 empty
     */
    public static Optional<OrderEventType> fromDetailType(String detailType) {
        for (OrderEventType type : values()) {
            if (type.detailType.equals(detailType)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String detailType() {
        return detailType;
    }

    public String source() {
        return source;
    }

    public OrderStatus targetStatus() {
        return targetStatus;
    }

    /**
     * 페이로드에 products 배열이 반드시 있어야 하는지 여부.
     *
     * @return PackageCreated인 경우 true
     */
    public boolean productsRequired() {
        return productsRequired;
    }
}
