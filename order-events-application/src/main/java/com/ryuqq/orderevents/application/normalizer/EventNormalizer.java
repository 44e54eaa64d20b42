package com.ryuqq.orderevents.application.normalizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.orderevents.application.codec.EventEnvelopeCodec;
import com.ryuqq.orderevents.core.contract.DomainEvent;
import com.ryuqq.orderevents.core.contract.EventPayload;
import com.ryuqq.orderevents.core.contract.NormalizedEvent;
import com.ryuqq.orderevents.core.contract.OrderEventType;
import com.ryuqq.orderevents.core.exception.InvalidPayloadException;
import com.ryuqq.orderevents.core.exception.MalformedEventException;
import com.ryuqq.orderevents.core.model.Order;
import com.ryuqq.orderevents.core.model.OrderId;
import com.ryuqq.orderevents.core.model.Product;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 인바운드 이벤트 정규화.
 *
 * <p>봉투 필드를 검증하고 detail JSON을 {@link EventPayload}로 해석합니다. 부수 효과가 없습니다.</p>
 *
 * <p><strong>봉투 검증 ({@link MalformedEventException}):</strong></p>
 * <ul>
 *   <li>source, detailType이 비어 있음</li>
 *   <li>resources가 없거나 항목이 정확히 하나가 아님</li>
 *   <li>resources 항목이 유효한 orderId가 아님</li>
 * </ul>
 *
 * <p><strong>detail 검증 ({@link InvalidPayloadException}, 처리 대상 detail-type만):</strong></p>
 * <ul>
 *   <li>비어 있거나 JSON 객체가 아님</li>
 *   <li>orderId가 resources와 다름</li>
 *   <li>PackageCreated에 products 배열이 없거나 productId가 없는 상품이 있음</li>
 * </ul>
 *
 * <p>처리 대상이 아닌 detail-type은 detail을 해석하지 않고 빈 페이로드로 넘깁니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class EventNormalizer {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * 기본 ObjectMapper로 생성.
     */
    public EventNormalizer() {
        this(EventEnvelopeCodec.defaultObjectMapper());
    }

    /**
     * 생성자.
     *
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public EventNormalizer(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 이벤트 정규화.
     *
     * @param event 인바운드 이벤트
     * @return 정규화된 이벤트
     * @throws MalformedEventException 봉투 형태가 올바르지 않은 경우
     * @throws InvalidPayloadException detail 형태가 올바르지 않은 경우
     */
    public NormalizedEvent normalize(DomainEvent event) {
        if (event == null) {
            throw new MalformedEventException("event cannot be null");
        }
        if (event.detailType() == null || event.detailType().isBlank()) {
            throw new MalformedEventException("detail-type cannot be null or blank");
        }
        if (event.source() == null || event.source().isBlank()) {
            throw new MalformedEventException("source cannot be null or blank");
        }
        OrderId orderId = orderIdOf(event);

        Optional<OrderEventType> type = OrderEventType.fromDetailType(event.detailType());
        EventPayload payload = type.isPresent()
            ? parsePayload(type.get(), orderId, event.detail())
            : EventPayload.empty();

        return new NormalizedEvent(event.source(), event.detailType(), orderId, payload);
    }

    private static OrderId orderIdOf(DomainEvent event) {
        List<String> resources = event.resources();
        if (resources == null) {
            throw new MalformedEventException("resources cannot be null");
        }
        if (resources.size() != 1) {
            throw new MalformedEventException(
                "resources must contain exactly one orderId (current: " + resources + ")");
        }
        try {
            return OrderId.of(resources.get(0));
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("resources entry is not a valid orderId: " + resources.get(0), e);
        }
    }

    private EventPayload parsePayload(OrderEventType type, OrderId orderId, String detail) {
        if (detail == null || detail.isBlank()) {
            throw new InvalidPayloadException(type.detailType() + " detail cannot be null or blank");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(detail);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException(type.detailType() + " detail is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidPayloadException(type.detailType() + " detail must be a JSON object");
        }

        JsonNode detailOrderId = root.get(Order.ORDER_ID);
        if (detailOrderId != null && !detailOrderId.isNull()
            && !(detailOrderId.isTextual() && detailOrderId.asText().equals(orderId.getValue()))) {
            throw new InvalidPayloadException(
                String.format("detail orderId %s does not match resource %s", detailOrderId, orderId.getValue()));
        }

        List<Product> products = type.productsRequired() ? products(type, root.get(Order.PRODUCTS)) : null;
        Map<String, Object> fields = objectMapper.convertValue(root, FIELD_MAP);
        return new EventPayload(products, fields);
    }

    private List<Product> products(OrderEventType type, JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new InvalidPayloadException(type.detailType() + " detail requires a products array");
        }
        List<Product> products = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw new InvalidPayloadException("product must be an object (current: " + element + ")");
            }
            JsonNode productId = element.get(Product.PRODUCT_ID);
            if (productId == null || !productId.isTextual() || productId.asText().isBlank()) {
                throw new InvalidPayloadException("product requires a textual productId (current: " + element + ")");
            }
            products.add(Product.fromFieldMap(objectMapper.convertValue(element, FIELD_MAP)));
        }
        return products;
    }
}
