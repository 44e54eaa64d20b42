package com.ryuqq.orderevents.testkit.fixture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.orderevents.core.contract.ChangeDetail;
import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.contract.DomainEvent;
import com.ryuqq.orderevents.core.contract.OrderEventType;
import com.ryuqq.orderevents.core.diff.OrderDiff;
import com.ryuqq.orderevents.core.model.Order;
import com.ryuqq.orderevents.core.model.OrderId;
import com.ryuqq.orderevents.core.model.OrderStatus;
import com.ryuqq.orderevents.core.model.Product;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Test data builders for orders, inbound events and change events.
 *
 * <p>Orders look like those written by the order creation service: a user, three product lines
 * with package dimensions, a delivery address and price totals.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * Order order = OrderFixtures.order();
 * store.put(order);
 * DomainEvent event = OrderFixtures.packageCreated(order, "P2", "P3");
 * </pre>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
public final class OrderFixtures {

    public static final String EVENT_BUS_NAME = "ecommerce-test-bus";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Utility class - prevent instantiation
    private OrderFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Generates a unique order identifier.
     *
     * @return new OrderId
     */
    public static OrderId newOrderId() {
        return OrderId.of(UUID.randomUUID().toString());
    }

    /**
     * Creates a CREATED order with a random id and products P1, P2, P3.
     *
     * @return new Order
     */
    public static Order order() {
        return order(newOrderId(), OrderStatus.CREATED);
    }

    /**
     * Creates an order with products P1, P2, P3.
     *
     * @param orderId order identifier
     * @param status order status
     * @return new Order
     */
    public static Order order(OrderId orderId, OrderStatus status) {
        List<Product> products = List.of(
            product("P1", "Shoe", 1500, 1),
            product("P2", "Hat", 700, 2),
            product("P3", "Scarf", 450, 1)
        );

        Map<String, Object> address = new LinkedHashMap<>();
        address.put("name", "Jane Doe");
        address.put("streetAddress", "123 Test St");
        address.put("city", "Testville");
        address.put("country", "US");
        address.put("phoneNumber", "+11234567890");

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("userId", "U-" + orderId.getValue());
        attributes.put("createdDate", "2024-01-01T00:00:00Z");
        attributes.put("modifiedDate", "2024-01-01T00:00:00Z");
        attributes.put("address", address);
        attributes.put("deliveryPrice", 200);
        attributes.put("total", 3550);
        attributes.put("paymentToken", "token-" + orderId.getValue());

        return new Order(orderId, status, products, attributes);
    }

    /**
     * Creates a product line with package metadata.
     *
     * @param productId product identifier
     * @param name product name
     * @param price unit price in cents
     * @param quantity quantity ordered
     * @return new Product
     */
    public static Product product(String productId, String name, int price, int quantity) {
        Map<String, Object> pkg = new LinkedHashMap<>();
        pkg.put("width", 200);
        pkg.put("length", 100);
        pkg.put("height", 50);
        pkg.put("weight", 1000);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        attributes.put("package", pkg);
        attributes.put("price", price);
        attributes.put("quantity", quantity);
        return new Product(productId, attributes);
    }

    // ========== Inbound events ==========

    /**
     * Creates an inbound event carrying the order snapshot as its detail.
     *
     * @param source event source
     * @param detailType detail-type
     * @param order order snapshot
     * @return new DomainEvent
     */
    public static DomainEvent event(String source, String detailType, Order order) {
        return new DomainEvent(
            source,
            detailType,
            List.of(order.orderId().getValue()),
            toJson(order.toFieldMap()),
            EVENT_BUS_NAME,
            Instant.now()
        );
    }

    /**
     * PackageCreated carrying the stored order as-is.
     *
     * @param order order snapshot
     * @return new DomainEvent
     */
    public static DomainEvent packageCreated(Order order) {
        return event(OrderEventType.PACKAGE_CREATED.source(), OrderEventType.PACKAGE_CREATED.detailType(), order);
    }

    /**
     * PackageCreated listing only the given products.
     *
     * @param order order snapshot
     * @param packagedProductIds products that made it into the package
     * @return new DomainEvent
     */
    public static DomainEvent packageCreated(Order order, String... packagedProductIds) {
        List<String> keep = Arrays.asList(packagedProductIds);
        List<Product> packaged = new ArrayList<>();
        for (Product product : order.products()) {
            if (keep.contains(product.productId())) {
                packaged.add(product);
            }
        }
        return packageCreated(order.withProducts(packaged));
    }

    public static DomainEvent packagingFailed(Order order) {
        return event(OrderEventType.PACKAGING_FAILED.source(), OrderEventType.PACKAGING_FAILED.detailType(), order);
    }

    public static DomainEvent deliveryCompleted(Order order) {
        return event(OrderEventType.DELIVERY_COMPLETED.source(), OrderEventType.DELIVERY_COMPLETED.detailType(), order);
    }

    public static DomainEvent deliveryFailed(Order order) {
        return event(OrderEventType.DELIVERY_FAILED.source(), OrderEventType.DELIVERY_FAILED.detailType(), order);
    }

    // ========== Change events ==========

    /**
     * Creates the change event describing {@code before → after}.
     *
     * @param before pre-image
     * @param after post-image
     * @return new ChangeEvent
     */
    public static ChangeEvent changeEvent(Order before, Order after) {
        ChangeDetail detail = new ChangeDetail(
            new ArrayList<>(OrderDiff.changedFields(before, after)),
            before.toFieldMap(),
            after.toFieldMap()
        );
        return ChangeEvent.orderModified(
            UUID.randomUUID().toString(),
            "ecommerce.orders",
            after.orderId(),
            detail,
            EVENT_BUS_NAME,
            Instant.now()
        );
    }

    /**
     * Serializes a JSON-shaped value.
     *
     * @param value maps, lists and scalars
     * @return JSON text
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize fixture: " + value, e);
        }
    }
}
