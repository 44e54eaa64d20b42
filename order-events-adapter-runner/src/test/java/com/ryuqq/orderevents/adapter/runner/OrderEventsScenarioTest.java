package com.ryuqq.orderevents.adapter.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.orderevents.adapter.inmemory.bus.InMemoryEventBus;
import com.ryuqq.orderevents.adapter.inmemory.config.InMemoryConfigProvider;
import com.ryuqq.orderevents.adapter.inmemory.queue.InMemoryEventQueue;
import com.ryuqq.orderevents.adapter.inmemory.store.InMemoryOrderStore;
import com.ryuqq.orderevents.application.codec.EventEnvelopeCodec;
import com.ryuqq.orderevents.application.config.OnEventsConfig;
import com.ryuqq.orderevents.application.handler.OnEventsHandler;
import com.ryuqq.orderevents.application.publisher.ChangePublisher;
import com.ryuqq.orderevents.core.contract.ChangeEvent;
import com.ryuqq.orderevents.core.contract.DomainEvent;
import com.ryuqq.orderevents.core.model.Order;
import com.ryuqq.orderevents.core.model.OrderId;
import com.ryuqq.orderevents.core.model.OrderStatus;
import com.ryuqq.orderevents.core.model.Product;
import com.ryuqq.orderevents.core.outcome.HandlingOutcome;
import com.ryuqq.orderevents.core.outcome.Processed;
import com.ryuqq.orderevents.core.outcome.Retry;
import com.ryuqq.orderevents.testkit.fixture.OrderFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 인메모리 어댑터 위에서 큐 → 핸들러 → 저장소 → 버스 전체 흐름을 검증하는 시나리오 테스트.
 *
 * <p>발행된 변경 이벤트는 버스 메시지 본문(JSON 봉투)으로 인코딩해 확인합니다.</p>
 *
 * @author Order Events Team
 * @since 1.0.0
 */
class OrderEventsScenarioTest {

    private static final String ENVIRONMENT = "test";

    private final ObjectMapper mapper = new ObjectMapper();
    private final EventEnvelopeCodec codec = new EventEnvelopeCodec();

    private InMemoryOrderStore store;
    private InMemoryEventBus bus;
    private InMemoryEventQueue queue;
    private OnEventsConfig config;
    private OnEventsHandler handler;
    private DeliveryRunner runner;

    @BeforeEach
    void setUp() {
        InMemoryConfigProvider provider = new InMemoryConfigProvider(ENVIRONMENT)
            .put(OnEventsConfig.TABLE_NAME_PARAMETER, "ecommerce-test-orders")
            .put(OnEventsConfig.EVENT_BUS_NAME_PARAMETER, "ecommerce-test-bus");
        config = OnEventsConfig.load(provider);

        store = new InMemoryOrderStore(config.tableName());
        bus = new InMemoryEventBus(config.eventBusName());
        queue = new InMemoryEventQueue(5_000);
        handler = new OnEventsHandler(store, bus, config);
        runner = new DeliveryRunner(queue, handler, new RunnerConfig().withMaxAttempts(3),
            new BackoffCalculator(10, 50, 0.0));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runner.shutdown();
    }

    private void deliver(DomainEvent event) {
        queue.publish(event, 0);
        runner.pump();
    }

    /**
     * 버스 메시지 본문 중 해당 주문의 OrderModified 이벤트.
     */
    private List<JsonNode> messagesFor(OrderId orderId) throws Exception {
        List<JsonNode> bodies = new ArrayList<>();
        for (ChangeEvent change : bus.published()) {
            JsonNode body = mapper.readTree(codec.encode(change));
            if (body.get("resources").toString().contains("\"" + orderId.getValue() + "\"")
                && "OrderModified".equals(body.get("detail-type").asText())) {
                bodies.add(body);
            }
        }
        return bodies;
    }

    private static List<String> changed(JsonNode body) {
        List<String> changed = new ArrayList<>();
        body.get("detail").get("changed").forEach(node -> changed.add(node.asText()));
        return changed;
    }

    // ============================================================
    // 1. 인바운드 이벤트별 전이
    // ============================================================

    @Test
    void PackageCreated_주문을_PACKAGED로_변경하고_status만_변경으로_발행() throws Exception {
        // given
        Order order = OrderFixtures.order();
        store.put(order);

        // when
        deliver(OrderFixtures.packageCreated(order));

        // then
        Order stored = store.get(order.orderId()).orElseThrow();
        assertThat(stored.status()).isEqualTo(OrderStatus.PACKAGED);
        assertThat(stored.products()).isEqualTo(order.products());

        List<JsonNode> messages = messagesFor(order.orderId());
        assertThat(messages).hasSize(1);
        assertThat(changed(messages.get(0))).contains("status").doesNotContain("products");
        assertThat(messages.get(0).get("detail").get("new").get("status").asText()).isEqualTo("PACKAGED");
        assertThat(messages.get(0).get("source").asText()).isEqualTo(OnEventsConfig.DEFAULT_SOURCE);
        assertThat(messages.get(0).get("event-bus-name").asText()).isEqualTo("ecommerce-test-bus");
        assertThat(queue.inFlightSize()).isZero();
    }

    @Test
    void PackageCreated_일부_상품만_포장되면_products도_변경() throws Exception {
        // given
        Order order = OrderFixtures.order();
        store.put(order);
        String removed = order.products().get(0).productId();

        // when
        deliver(OrderFixtures.packageCreated(order, "P2", "P3"));

        // then
        Order stored = store.get(order.orderId()).orElseThrow();
        assertThat(stored.status()).isEqualTo(OrderStatus.PACKAGED);
        assertThat(stored.products()).hasSize(2);
        assertThat(stored.productIds()).doesNotContain(removed);

        List<JsonNode> messages = messagesFor(order.orderId());
        assertThat(messages).hasSize(1);
        assertThat(changed(messages.get(0))).contains("status", "products");
        assertThat(messages.get(0).get("detail").get("new").get("status").asText()).isEqualTo("PACKAGED");
    }

    @Test
    void PackagingFailed_주문을_PACKAGING_FAILED로_변경() throws Exception {
        Order order = OrderFixtures.order();
        store.put(order);

        deliver(OrderFixtures.packagingFailed(order));

        assertThat(store.get(order.orderId()).orElseThrow().status()).isEqualTo(OrderStatus.PACKAGING_FAILED);
        List<JsonNode> messages = messagesFor(order.orderId());
        assertThat(messages).hasSize(1);
        assertThat(changed(messages.get(0))).containsExactly("status");
        assertThat(messages.get(0).get("detail").get("new").get("status").asText()).isEqualTo("PACKAGING_FAILED");
    }

    @Test
    void DeliveryCompleted_주문을_FULFILLED로_변경() throws Exception {
        Order order = OrderFixtures.order();
        store.put(order);

        deliver(OrderFixtures.deliveryCompleted(order));

        assertThat(store.get(order.orderId()).orElseThrow().status()).isEqualTo(OrderStatus.FULFILLED);
        List<JsonNode> messages = messagesFor(order.orderId());
        assertThat(messages).hasSize(1);
        assertThat(changed(messages.get(0))).containsExactly("status");
        assertThat(messages.get(0).get("detail").get("new").get("status").asText()).isEqualTo("FULFILLED");
    }

    @Test
    void DeliveryFailed_주문을_DELIVERY_FAILED로_변경() throws Exception {
        Order order = OrderFixtures.order();
        store.put(order);

        deliver(OrderFixtures.deliveryFailed(order));

        assertThat(store.get(order.orderId()).orElseThrow().status()).isEqualTo(OrderStatus.DELIVERY_FAILED);
        List<JsonNode> messages = messagesFor(order.orderId());
        assertThat(messages).hasSize(1);
        assertThat(changed(messages.get(0))).containsExactly("status");
        assertThat(messages.get(0).get("detail").get("new").get("status").asText()).isEqualTo("DELIVERY_FAILED");
    }

    @Test
    void 최소_주문_O1_예시() throws Exception {
        // given
        OrderId orderId = OrderId.of("O1");
        store.put(new Order(orderId, OrderStatus.CREATED, List.of(Product.of("P1"), Product.of("P2")), Map.of()));
        DomainEvent event = DomainEvent.of("ecommerce.warehouse", "PackageCreated", "O1",
            "{\"orderId\":\"O1\",\"products\":[{\"productId\":\"P1\"}]}");

        // when
        deliver(event);

        // then
        Order stored = store.get(orderId).orElseThrow();
        assertThat(stored.status()).isEqualTo(OrderStatus.PACKAGED);
        assertThat(stored.products()).containsExactly(Product.of("P1"));

        List<JsonNode> messages = messagesFor(orderId);
        assertThat(messages).hasSize(1);
        assertThat(changed(messages.get(0))).containsExactlyInAnyOrder("status", "products");
        assertThat(messages.get(0).get("detail").get("new").get("status").asText()).isEqualTo("PACKAGED");
    }

    // ============================================================
    // 2. 멱등성 / 순서
    // ============================================================

    @Test
    void 같은_이벤트를_두번_전달해도_상태는_같고_두번째는_발행하지_않음() throws Exception {
        // given
        Order order = OrderFixtures.order();
        store.put(order);
        DomainEvent event = OrderFixtures.packageCreated(order);

        // when
        deliver(event);
        Order afterFirst = store.get(order.orderId()).orElseThrow();
        deliver(event);

        // then
        assertThat(store.get(order.orderId()).orElseThrow()).isEqualTo(afterFirst);
        assertThat(messagesFor(order.orderId())).hasSize(1);
        assertThat(store.pendingSize()).isZero();
    }

    @Test
    void 상품_순서만_다른_PackageCreated는_products_변경이_아님() throws Exception {
        Order order = OrderFixtures.order();
        store.put(order);

        deliver(OrderFixtures.packageCreated(order, "P3", "P1", "P2"));

        Order stored = store.get(order.orderId()).orElseThrow();
        assertThat(stored.productIds()).containsExactly("P1", "P2", "P3");
        assertThat(changed(messagesFor(order.orderId()).get(0))).containsExactly("status");
    }

    @Test
    void 처리_대상이_아닌_이벤트는_저장소와_버스를_바꾸지_않음() {
        Order order = OrderFixtures.order();
        store.put(order);

        deliver(OrderFixtures.event("ecommerce.orders", "OrderCreated", order));
        deliver(OrderFixtures.event("ecommerce.delivery", "PackageCreated", order));

        assertThat(store.get(order.orderId())).contains(order);
        assertThat(bus.published()).isEmpty();
        assertThat(queue.inFlightSize()).isZero();
        assertThat(queue.getDeadLetters()).isEmpty();
    }

    // ============================================================
    // 3. 실패와 복구
    // ============================================================

    @Test
    void 발행_실패_후_재전달되면_pending_변경을_재발행() throws Exception {
        // given
        Order order = OrderFixtures.order();
        store.put(order);
        bus.failNextPublishes(1);

        // when
        deliver(OrderFixtures.packageCreated(order));

        // then: 저장은 되었지만 발행은 pending
        assertThat(store.get(order.orderId()).orElseThrow().status()).isEqualTo(OrderStatus.PACKAGED);
        assertThat(bus.published()).isEmpty();
        assertThat(store.pendingSize()).isEqualTo(1);

        // when: backoff 후 재전달
        long deadline = System.currentTimeMillis() + 2_000;
        while (bus.published().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            runner.pump();
        }

        // then
        List<JsonNode> messages = messagesFor(order.orderId());
        assertThat(messages).hasSize(1);
        assertThat(changed(messages.get(0))).containsExactly("status");
        assertThat(store.pendingSize()).isZero();
    }

    @Test
    void 발행_실패한_변경은_ChangeFinalizer가_복구() throws Exception {
        // given
        Order order = OrderFixtures.order();
        store.put(order);
        bus.failNextPublishes(1);
        assertThat(handler.handle(OrderFixtures.deliveryCompleted(order))).isInstanceOf(Retry.class);

        ChangeFinalizer finalizer = new ChangeFinalizer(store, new ChangePublisher(bus, config), new FinalizerConfig());

        // when
        int recovered = finalizer.scan();

        // then
        assertThat(recovered).isEqualTo(1);
        assertThat(store.pendingSize()).isZero();
        assertThat(messagesFor(order.orderId())).hasSize(1);
        assertThat(finalizer.scan()).isZero();
    }

    @Test
    void 종료_상태_주문에_대한_전이는_DLQ로_이동() {
        Order order = OrderFixtures.order(OrderFixtures.newOrderId(), OrderStatus.FULFILLED);
        store.put(order);

        deliver(OrderFixtures.packagingFailed(order));

        assertThat(store.get(order.orderId())).contains(order);
        assertThat(bus.published()).isEmpty();
        assertThat(queue.getDeadLetters()).hasSize(1);
        assertThat(queue.getDeadLetters().get(0).reason()).startsWith("INVALID_TRANSITION");
    }

    @Test
    void 없는_주문은_재시도_후_DLQ로_이동() throws Exception {
        Order order = OrderFixtures.order();

        deliver(OrderFixtures.deliveryCompleted(order));
        long deadline = System.currentTimeMillis() + 2_000;
        while (queue.getDeadLetters().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            runner.pump();
        }

        assertThat(queue.getDeadLetters()).hasSize(1);
        assertThat(queue.getDeadLetters().get(0).delivery().attempt()).isEqualTo(3);
        assertThat(queue.getDeadLetters().get(0).reason()).startsWith("ORDER_NOT_FOUND");
        assertThat(bus.published()).isEmpty();
    }

    // ============================================================
    // 4. 발행 이미지와 저장 주문의 분리
    // ============================================================

    @Test
    void 발행된_이미지의_중첩_값을_수정해도_저장된_주문은_그대로() {
        // given
        Order order = OrderFixtures.order();
        store.put(order);

        // when
        HandlingOutcome outcome = handler.handle(OrderFixtures.packagingFailed(order));

        // then
        assertThat(outcome).isInstanceOf(Processed.class);
        assertThat(bus.published()).hasSize(1);

        List<?> products = (List<?>) bus.published().get(0).detail().newImage().get("products");
        @SuppressWarnings("unchecked")
        Map<String, Object> pkg = (Map<String, Object>) ((Map<?, ?>) products.get(0)).get("package");
        assertThatThrownBy(() -> pkg.put("width", 999))
            .isInstanceOf(UnsupportedOperationException.class);

        Order stored = store.get(order.orderId()).orElseThrow();
        Map<?, ?> storedPackage = (Map<?, ?>) stored.products().get(0).attributes().get("package");
        assertThat(storedPackage.get("width")).isEqualTo(200);
    }
}
