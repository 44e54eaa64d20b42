package com.ryuqq.orderevents.application.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.contract.DomainEvent;
import com.ryuqq.orderevents.core.exception.MalformedEventException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * 이벤트 봉투 JSON 변환기.
 *
 * <p><strong>수신 형식 (decode):</strong></p>
 * <ul>
 *   <li>전달 형식: {@code source}, {@code detail-type}, {@code resources}, {@code detail}(객체), {@code time}</li>
 *   <li>PutEvents 항목 형식: {@code Source}, {@code DetailType}, {@code Resources}, {@code Detail}(JSON 문자열),
 *       {@code EventBusName}, {@code Time}</li>
 * </ul>
 *
 * <p><strong>발행 형식 (encode):</strong></p>
 * <pre>
 * {
 *   "id": "...", "source": "ecommerce.orders", "detail-type": "OrderModified",
 *   "resources": ["O1"],
 *   "detail": {"changed": ["status"], "old": {...}, "new": {...}},
 *   "event-bus-name": "...", "time": "2024-05-01T10:15:30Z"
 * }
 * </pre>
 *
 * <p>봉투 수준의 형태만 확인합니다. 필드 값 검증은 {@code EventNormalizer}의 책임입니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public class EventEnvelopeCodec {

    private final ObjectMapper objectMapper;

    /**
     * 기본 ObjectMapper로 생성.
     */
    public EventEnvelopeCodec() {
        this(defaultObjectMapper());
    }

    /**
     * 생성자.
     *
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public EventEnvelopeCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 이 모듈이 사용하는 기본 ObjectMapper 생성.
     *
     * <p>소수는 BigDecimal로 읽어 가격 필드가 변형 없이 저장되도록 합니다.</p>
     *
     * @return 새 ObjectMapper
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * 수신 봉투 해석.
     *
     * @param json 봉투 JSON
     * @return DomainEvent
     * @throws MalformedEventException JSON이 아니거나 객체가 아닌 경우, 필드 타입이 올바르지 않은 경우
     */
    public DomainEvent decode(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedEventException("envelope cannot be null or blank");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("envelope is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("envelope must be a JSON object");
        }

        if (root.has("DetailType") || root.has("Source")) {
            return new DomainEvent(
                text(root, "Source"),
                text(root, "DetailType"),
                resources(root, "Resources"),
                detail(root, "Detail"),
                text(root, "EventBusName"),
                time(root, "Time")
            );
        }
        return new DomainEvent(
            text(root, "source"),
            text(root, "detail-type"),
            resources(root, "resources"),
            detail(root, "detail"),
            text(root, "event-bus-name"),
            time(root, "time")
        );
    }

    /**
     * 변경 이벤트를 발행 봉투로 직렬화.
     *
     * @param event 변경 이벤트
     * @return 봉투 JSON
     * @throws IllegalArgumentException event가 null인 경우
     */
    public String encode(ChangeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", event.eventId());
        root.put("source", event.source());
        root.put("detail-type", event.detailType());
        ArrayNode resources = root.putArray("resources");
        event.resources().forEach(resources::add);

        ObjectNode detail = root.putObject("detail");
        ArrayNode changed = detail.putArray("changed");
        event.detail().changed().forEach(changed::add);
        detail.set("old", objectMapper.valueToTree(event.detail().oldImage()));
        detail.set("new", objectMapper.valueToTree(event.detail().newImage()));

        if (event.eventBusName() != null) {
            root.put("event-bus-name", event.eventBusName());
        }
        root.put("time", event.time().toString());

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize change event " + event.eventId(), e);
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new MalformedEventException(field + " must be a string (current: " + node + ")");
        }
        return node.asText();
    }

    private static List<String> resources(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new MalformedEventException(field + " must be an array (current: " + node + ")");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            values.add(element.isTextual() ? element.asText() : null);
        }
        return values;
    }

    private String detail(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException(field + " cannot be serialized", e);
        }
    }

    private static Instant time(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochSecond(node.asLong());
        }
        String value = node.asText();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                // ISO local date-time without offset, e.g. "2024-05-01 10:15:30.123456"
                return LocalDateTime.parse(value.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException nested) {
                nested.addSuppressed(e);
                throw new MalformedEventException(field + " is not a timestamp (current: " + value + ")", nested);
            }
        }
    }
}
